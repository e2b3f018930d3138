package stages;

import image.LinearImage;
import params.AdjustmentParameters;

/**
 * Crop and free rotation, applied ahead of the tone work.
 */
final class Geometry {

    static final float ROTATION_EPSILON = 0.01f;

    private Geometry() {
    }

    static boolean isIdentity(AdjustmentParameters p) {
        return Math.abs(p.rotation()) < ROTATION_EPSILON && !p.cropEnabled();
    }

    static LinearImage apply(LinearImage src, AdjustmentParameters p) {
        LinearImage img = src;
        if (Math.abs(p.rotation()) >= ROTATION_EPSILON)
            img = rotate(img, p.rotation());
        if (p.cropEnabled())
            img = crop(img, p.cropLeft(), p.cropTop(), p.cropRight(), p.cropBottom());
        return img;
    }

    /** Normalized crop rectangle; always keeps at least one pixel. */
    static LinearImage crop(LinearImage src, float left, float top, float right, float bottom) {
        int w = src.width(), h = src.height();
        int x0 = clamp(Math.round(clamp01(left) * w), 0, w - 1);
        int y0 = clamp(Math.round(clamp01(top) * h), 0, h - 1);
        int x1 = clamp(Math.round(clamp01(right) * w), x0 + 1, w);
        int y1 = clamp(Math.round(clamp01(bottom) * h), y0 + 1, h);
        int cw = x1 - x0, ch = y1 - y0;
        LinearImage out = LinearImage.blank(cw, ch);
        for (int y = 0; y < ch; y++) {
            int s = (y0 + y) * w + x0;
            int d = y * cw;
            System.arraycopy(src.r(), s, out.r(), d, cw);
            System.arraycopy(src.g(), s, out.g(), d, cw);
            System.arraycopy(src.b(), s, out.b(), d, cw);
        }
        return out;
    }

    /**
     * Rotate about the center by {@code degrees} (clockwise) on the same canvas,
     * sampling bilinearly and clamping to the edge.
     */
    static LinearImage rotate(LinearImage src, float degrees) {
        int w = src.width(), h = src.height();
        double rad = Math.toRadians(degrees);
        float cos = (float) Math.cos(rad), sin = (float) Math.sin(rad);
        float cx = (w - 1) / 2f, cy = (h - 1) / 2f;
        LinearImage out = LinearImage.blank(w, h);
        float[][] in = { src.r(), src.g(), src.b() };
        float[][] dst = { out.r(), out.g(), out.b() };

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float dx = x - cx, dy = y - cy;
                // inverse mapping: output pixel back into the source
                float sx = clampf(cos * dx + sin * dy + cx, 0f, w - 1);
                float sy = clampf(-sin * dx + cos * dy + cy, 0f, h - 1);
                int x0 = (int) sx, y0 = (int) sy;
                int x1 = Math.min(x0 + 1, w - 1), y1 = Math.min(y0 + 1, h - 1);
                float tx = sx - x0, ty = sy - y0;
                int o = y * w + x;
                for (int c = 0; c < 3; c++) {
                    float[] p = in[c];
                    float top = p[y0 * w + x0] * (1f - tx) + p[y0 * w + x1] * tx;
                    float bot = p[y1 * w + x0] * (1f - tx) + p[y1 * w + x1] * tx;
                    dst[c][o] = top * (1f - ty) + bot * ty;
                }
            }
        }
        return out;
    }

    private static int clamp(int v, int lo, int hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }

    private static float clampf(float v, float lo, float hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }

    private static float clamp01(float v) {
        return clampf(v, 0f, 1f);
    }
}
