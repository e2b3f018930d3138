package image;

import java.util.Arrays;

/**
 * Three-plane float image in linear light.
 *
 * Planes are exposed directly for the kernels; an instance is owned by one stage or
 * cache slot at a time and kernels never write into an image they did not allocate.
 */
public final class LinearImage {

    public static final float LUMA_R = 0.2126f;
    public static final float LUMA_G = 0.7152f;
    public static final float LUMA_B = 0.0722f;

    private final int width;
    private final int height;
    private final float[] r;
    private final float[] g;
    private final float[] b;

    public LinearImage(int width, int height, float[] r, float[] g, float[] b) {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("image dimensions must be positive: " + width + "x" + height);
        int n = width * height;
        if (r.length != n || g.length != n || b.length != n)
            throw new IllegalArgumentException("plane length mismatch for " + width + "x" + height
                    + ": r=" + r.length + " g=" + g.length + " b=" + b.length);
        this.width = width;
        this.height = height;
        this.r = r;
        this.g = g;
        this.b = b;
    }

    /** Zero-filled image. */
    public static LinearImage blank(int width, int height) {
        int n = width * height;
        return new LinearImage(width, height, new float[n], new float[n], new float[n]);
    }

    public static LinearImage filled(int width, int height, float rv, float gv, float bv) {
        LinearImage img = blank(width, height);
        Arrays.fill(img.r, rv);
        Arrays.fill(img.g, gv);
        Arrays.fill(img.b, bv);
        return img;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public float[] r() {
        return r;
    }

    public float[] g() {
        return g;
    }

    public float[] b() {
        return b;
    }

    public float luminance(int i) {
        return LUMA_R * r[i] + LUMA_G * g[i] + LUMA_B * b[i];
    }

    public LinearImage copy() {
        return new LinearImage(width, height, r.clone(), g.clone(), b.clone());
    }

    /** Bytes held by the three planes. */
    public long byteSize() {
        return estimateBytes(width, height);
    }

    public static long estimateBytes(int w, int h) {
        return (long) w * (long) h * 3L * Float.BYTES;
    }

    /**
     * 64-bit content hash over dimensions and the raw float bits of every sample.
     * Used as cache identity and for corruption checks, so it must only depend on content.
     */
    public long contentHash() {
        long h = 0x9E3779B97F4A7C15L ^ ((long) width << 32 | height);
        h = mixPlane(h, r);
        h = mixPlane(h, g);
        h = mixPlane(h, b);
        return finish(h);
    }

    private static long mixPlane(long h, float[] p) {
        for (float v : p) {
            h ^= Float.floatToIntBits(v) & 0xFFFFFFFFL;
            h *= 0x100000001B3L;
            h = Long.rotateLeft(h, 27);
        }
        return h;
    }

    private static long finish(long h) {
        h ^= h >>> 33;
        h *= 0xFF51AFD7ED558CCDL;
        h ^= h >>> 33;
        h *= 0xC4CEB9FE1A85EC53L;
        h ^= h >>> 33;
        return h;
    }

    /**
     * Box-average downscale so the long edge is at most {@code maxEdge}.
     * Returns this image when it already fits.
     */
    public LinearImage downscaleToFit(int maxEdge) {
        int longEdge = Math.max(width, height);
        if (maxEdge <= 0 || longEdge <= maxEdge)
            return this;
        double scale = (double) longEdge / maxEdge;
        int nw = Math.max(1, (int) Math.round(width / scale));
        int nh = Math.max(1, (int) Math.round(height / scale));
        LinearImage out = blank(nw, nh);
        for (int y = 0; y < nh; y++) {
            int y0 = (int) Math.floor(y * (double) height / nh);
            int y1 = Math.max(y0 + 1, (int) Math.floor((y + 1) * (double) height / nh));
            for (int x = 0; x < nw; x++) {
                int x0 = (int) Math.floor(x * (double) width / nw);
                int x1 = Math.max(x0 + 1, (int) Math.floor((x + 1) * (double) width / nw));
                float sr = 0, sg = 0, sb = 0;
                int count = 0;
                for (int sy = y0; sy < y1 && sy < height; sy++) {
                    int row = sy * width;
                    for (int sx = x0; sx < x1 && sx < width; sx++) {
                        int i = row + sx;
                        sr += r[i];
                        sg += g[i];
                        sb += b[i];
                        count++;
                    }
                }
                int o = y * nw + x;
                out.r[o] = sr / count;
                out.g[o] = sg / count;
                out.b[o] = sb / count;
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "LinearImage[" + width + "x" + height + "]";
    }
}
