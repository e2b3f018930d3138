package pipeline;

import java.nio.file.Path;
import java.util.Locale;

/**
 * @param jpegQuality 0..1, ignored for PNG
 */
public record ExportOptions(Path output, Format format, float jpegQuality, boolean dither, boolean softClip) {

    public enum Format {
        PNG, JPEG;

        public static Format fromPath(Path p) {
            String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
            return (n.endsWith(".jpg") || n.endsWith(".jpeg")) ? JPEG : PNG;
        }
    }

    public ExportOptions {
        if (output == null)
            throw new IllegalArgumentException("output path is required");
        if (jpegQuality < 0f || jpegQuality > 1f)
            throw new IllegalArgumentException("jpegQuality must be in [0,1]: " + jpegQuality);
    }

    /** Format from the file extension, dithering on. */
    public static ExportOptions forPath(Path output) {
        return new ExportOptions(output, Format.fromPath(output), 0.92f, true, false);
    }

    public ExportOptions withDither(boolean dither) {
        return new ExportOptions(output, format, jpegQuality, dither, softClip);
    }

    public ExportOptions withJpegQuality(float q) {
        return new ExportOptions(output, format, q, dither, softClip);
    }
}
