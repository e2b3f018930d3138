package util;

import image.LinearImage;

import java.util.Arrays;

/**
 * Reconstructs RGB from a single-plane Bayer mosaic. Mosaic samples are linear and
 * normalized to [0,1] by the reader.
 */
public final class BayerDemosaic {

    private BayerDemosaic() {
    }

    /** Each missing channel is the mean of the same-color samples in the 3×3 neighborhood. */
    public static LinearImage bilinear(float[] mosaic, int w, int h, CfaPattern pattern) {
        checkArgs(mosaic, w, h);
        LinearImage out = LinearImage.blank(w, h);
        final float[][] planes = { out.r(), out.g(), out.b() };

        ParallelRows.forRows(h, (y0, y1) -> {
            float[] sum = new float[3];
            int[] count = new int[3];
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    int i = y * w + x;
                    int own = pattern.colorAt(x, y);
                    Arrays.fill(sum, 0f);
                    Arrays.fill(count, 0);
                    for (int dy = -1; dy <= 1; dy++) {
                        int ny = y + dy;
                        if (ny < 0 || ny >= h)
                            continue;
                        for (int dx = -1; dx <= 1; dx++) {
                            int nx = x + dx;
                            if (nx < 0 || nx >= w)
                                continue;
                            int c = pattern.colorAt(nx, ny);
                            sum[c] += mosaic[ny * w + nx];
                            count[c]++;
                        }
                    }
                    for (int c = 0; c < 3; c++) {
                        if (c == own)
                            planes[c][i] = mosaic[i];
                        else
                            planes[c][i] = count[c] > 0 ? sum[c] / count[c] : 0f;
                    }
                }
            }
        });
        return out;
    }

    /**
     * Green from the orthogonal neighbors, bilinear red and blue, then chroma-difference
     * smoothing along rows. With {@code reduceZipper} interior pixels are pulled 30% toward
     * their 3×3 median.
     */
    public static LinearImage edgeAware(float[] mosaic, int w, int h, CfaPattern pattern, boolean reduceZipper) {
        LinearImage base = bilinear(mosaic, w, h, pattern);
        final float[] g = base.g();

        // green at red/blue sites: orthogonal neighbors only
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (pattern.colorAt(x, y) == CfaPattern.GREEN)
                    continue;
                int i = y * w + x;
                float sum = 0f;
                int n = 0;
                if (x > 0) { sum += mosaic[i - 1]; n++; }
                if (x < w - 1) { sum += mosaic[i + 1]; n++; }
                if (y > 0) { sum += mosaic[i - w]; n++; }
                if (y < h - 1) { sum += mosaic[i + w]; n++; }
                g[i] = n > 0 ? sum / n : mosaic[i];
            }
        }

        LinearImage out = smoothChroma(base);
        return reduceZipper ? reduceZipper(out) : out;
    }

    static LinearImage smoothChroma(LinearImage src) {
        final int w = src.width(), h = src.height();
        LinearImage out = src.copy();
        final float[] r = src.r(), g = src.g(), b = src.b();
        final float[] or = out.r(), ob = out.b();
        ParallelRows.forRows(h, (y0, y1) -> {
            for (int y = Math.max(1, y0); y < Math.min(h - 1, y1); y++) {
                for (int x = 1; x < w - 1; x++) {
                    int i = y * w + x;
                    float rg = (r[i] - g[i]) + (r[i - 1] - g[i - 1]) + (r[i + 1] - g[i + 1]);
                    float bg = (b[i] - g[i]) + (b[i - 1] - g[i - 1]) + (b[i + 1] - g[i + 1]);
                    or[i] = Math.max(0f, g[i] + rg / 3f);
                    ob[i] = Math.max(0f, g[i] + bg / 3f);
                }
            }
        });
        return out;
    }

    static LinearImage reduceZipper(LinearImage src) {
        final int w = src.width(), h = src.height();
        LinearImage out = src.copy();
        final float[][] in = { src.r(), src.g(), src.b() };
        final float[][] dst = { out.r(), out.g(), out.b() };
        ParallelRows.forRows(h, (y0, y1) -> {
            float[] window = new float[9];
            for (int y = Math.max(1, y0); y < Math.min(h - 1, y1); y++) {
                for (int x = 1; x < w - 1; x++) {
                    int i = y * w + x;
                    for (int c = 0; c < 3; c++) {
                        int k = 0;
                        for (int dy = -1; dy <= 1; dy++)
                            for (int dx = -1; dx <= 1; dx++)
                                window[k++] = in[c][i + dy * w + dx];
                        Arrays.sort(window);
                        dst[c][i] = 0.7f * in[c][i] + 0.3f * window[4];
                    }
                }
            }
        });
        return out;
    }

    private static void checkArgs(float[] mosaic, int w, int h) {
        if (w <= 0 || h <= 0)
            throw new IllegalArgumentException("Mosaic dimensions must be positive: " + w + "x" + h);
        if (mosaic.length != w * h)
            throw new IllegalArgumentException("Mosaic has " + mosaic.length + " samples, expected " + (w * h));
    }
}
