package io;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Binary PGM (P5) reader for single-plane sensor dumps. 8-bit and 16-bit (big-endian)
 * samples are normalized to [0,1] by maxval.
 */
final class PgmMosaicReader {

    /** Largest mosaic accepted, in samples. */
    static final long MAX_SAMPLES = 1L << 28;

    record Mosaic(int width, int height, int bitsPerSample, float[] samples) {
    }

    private PgmMosaicReader() {
    }

    static Mosaic read(Path path) throws DecodeException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return read(in, path);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException(path, "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    static Mosaic read(InputStream in, Path path) throws IOException {
        String magic = token(in, path);
        if (!"P5".equals(magic))
            throw new DecodeException(path, "Not a binary PGM (magic " + magic + ")");
        int w = number(in, path, "width");
        int h = number(in, path, "height");
        int maxval = number(in, path, "maxval");
        if (w <= 0 || h <= 0)
            throw new DecodeException(path, "Bad PGM dimensions " + w + "x" + h);
        if (maxval <= 0 || maxval > 65535)
            throw new DecodeException(path, "Bad PGM maxval " + maxval);

        long total = (long) w * h;
        if (total > MAX_SAMPLES)
            throw new DecodeException(path, "PGM too large: " + w + "x" + h);

        boolean wide = maxval > 255;
        int n = (int) total;
        float[] samples = new float[n];
        float scale = 1f / maxval;
        for (int i = 0; i < n; i++) {
            int v = in.read();
            if (wide) {
                int lo = in.read();
                if (v < 0 || lo < 0)
                    throw new DecodeException(path, "Truncated PGM data at sample " + i + " of " + n);
                v = (v << 8) | lo;
            } else if (v < 0) {
                throw new DecodeException(path, "Truncated PGM data at sample " + i + " of " + n);
            }
            samples[i] = Math.min(maxval, v) * scale;
        }
        return new Mosaic(w, h, wide ? 16 : 8, samples);
    }

    private static int number(InputStream in, Path path, String what) throws IOException {
        String t = token(in, path);
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException e) {
            throw new DecodeException(path, "Bad PGM " + what + ": " + t, e);
        }
    }

    /** Next whitespace-delimited header token; '#' comments run to end of line. */
    private static String token(InputStream in, Path path) throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = in.read()) != -1) {
            if (c == '#') {
                while ((c = in.read()) != -1 && c != '\n')
                    ;
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (sb.length() > 0)
                    return sb.toString();
                continue;
            }
            sb.append((char) c);
        }
        if (sb.length() == 0)
            throw new DecodeException(path, "Unexpected end of PGM header");
        return sb.toString();
    }
}
