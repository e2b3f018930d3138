package io;

import image.ColorSpace;
import image.LinearImage;
import io.SourceMetadata.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.BayerDemosaic;
import util.CfaPattern;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes a source file to a full-resolution linear image. The format is picked by extension:
 * {@code .arw} embedded preview, {@code .pgm} Bayer mosaic, anything else through ImageIO.
 */
public final class ImageLoader {

    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    public static final String CFA_PROPERTY = "cfa.pattern";

    private ImageLoader() {
    }

    public static DecodedSource decodeSource(Path input) throws DecodeException {
        if (input == null || !Files.isRegularFile(input))
            throw new DecodeException(input, "Source not found: " + input);

        String name = input.getFileName().toString().toLowerCase(Locale.ROOT);
        long t0 = System.nanoTime();
        DecodedSource decoded;
        if (name.endsWith(".arw")) {
            log.info("Detected RAW (.ARW) file, loading embedded preview: {}", input);
            BufferedImage bi = ArwPreviewReader.loadPreview(input);
            decoded = new DecodedSource(fromBufferedImage(bi),
                    new SourceMetadata(SourceFormat.RAW_PREVIEW, bi.getWidth(), bi.getHeight(), 8, null));
        } else if (name.endsWith(".pgm")) {
            decoded = decodeMosaic(input, cfaPattern(input));
        } else {
            BufferedImage bi = readRaster(input);
            decoded = new DecodedSource(fromBufferedImage(bi),
                    new SourceMetadata(SourceFormat.RASTER, bi.getWidth(), bi.getHeight(), 8, null));
        }
        log.info("Decoded {} ({}x{}, {}) in {} ms", input.getFileName(), decoded.image().width(),
                decoded.image().height(), decoded.metadata().format(), (System.nanoTime() - t0) / 1_000_000);
        return decoded;
    }

    static DecodedSource decodeMosaic(Path input, CfaPattern pattern) throws DecodeException {
        PgmMosaicReader.Mosaic m = PgmMosaicReader.read(input);
        LinearImage img = BayerDemosaic.edgeAware(m.samples(), m.width(), m.height(), pattern, true);
        return new DecodedSource(img,
                new SourceMetadata(SourceFormat.BAYER_MOSAIC, m.width(), m.height(), m.bitsPerSample(), pattern));
    }

    private static CfaPattern cfaPattern(Path input) throws DecodeException {
        String prop = System.getProperty(CFA_PROPERTY);
        if (prop == null || prop.isBlank())
            return CfaPattern.RGGB;
        try {
            return CfaPattern.parse(prop);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(input, e.getMessage(), e);
        }
    }

    private static BufferedImage readRaster(Path input) throws DecodeException {
        try (InputStream in = Files.newInputStream(input)) {
            BufferedImage bi = ImageIO.read(in);
            if (bi == null)
                throw new DecodeException(input, "Unsupported image format: " + input.getFileName());
            return bi;
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException(input, "Failed to read " + input + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // ImageIO plugins throw unchecked exceptions on some malformed streams
            throw new DecodeException(input, "Corrupt image " + input.getFileName() + ": " + e, e);
        }
    }

    /** 8-bit sRGB raster to linear light; alpha is dropped. */
    public static LinearImage fromBufferedImage(BufferedImage bi) {
        int w = bi.getWidth(), h = bi.getHeight();
        LinearImage img = LinearImage.blank(w, h);
        float[] r = img.r(), g = img.g(), b = img.b();
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            bi.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                int i = y * w + x;
                r[i] = ColorSpace.srgb8ToLinear((argb >> 16) & 0xFF);
                g[i] = ColorSpace.srgb8ToLinear((argb >> 8) & 0xFF);
                b[i] = ColorSpace.srgb8ToLinear(argb & 0xFF);
            }
        }
        return img;
    }
}
