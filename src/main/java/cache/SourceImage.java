package cache;

import image.LinearImage;
import io.SourceMetadata;
import params.ParameterHasher;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.HexFormat;

/**
 * The decoded full-resolution source. The id is derived from pixel content, so re-loading
 * the same file yields the same id.
 *
 * @param path where it was decoded from, {@code null} for in-memory sources
 */
public record SourceImage(String id, LinearImage image, SourceMetadata metadata, Path path) {

    public static SourceImage of(LinearImage image, SourceMetadata metadata, Path path) {
        return new SourceImage(contentId(image), image, metadata, path);
    }

    public static String contentId(LinearImage image) {
        ByteBuffer buf = ByteBuffer.allocate(16);
        buf.putLong(image.contentHash());
        buf.putInt(image.width());
        buf.putInt(image.height());
        return HexFormat.of().formatHex(ParameterHasher.sha256(buf.array()));
    }

    /** Identity of this source downscaled to a preview long edge. */
    public String previewId(int maxEdge) {
        return ParameterHasher.sha256Hex(id + ":" + maxEdge);
    }
}
