package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;
import util.ParallelRows;

/**
 * Geometry, exposure, contrast and the four tone-region sliders.
 *
 * Region sliders work on CIE L*: each slider owns a smoothstep band of lightness and the
 * pixel is rescaled so its luminance lands on the adjusted L*.
 */
public final class ToneBaseProcessor implements StageProcessor {

    static final float KAPPA = 903.3f;
    static final float EPSILON = 0.008856f;
    static final float CONTRAST_EPSILON = 0.001f;

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.TONE_BASE;
    }

    @Override
    public boolean shouldExecute(AdjustmentParameters p) {
        return p.globalExposure() != 0f
                || Math.abs(p.contrast() - 1f) >= CONTRAST_EPSILON
                || hasRegionAdjustments(p)
                || !Geometry.isIdentity(p);
    }

    private static boolean hasRegionAdjustments(AdjustmentParameters p) {
        return p.highlights() != 0f || p.shadows() != 0f || p.whites() != 0f || p.blacks() != 0f;
    }

    @Override
    public LinearImage process(LinearImage input, AdjustmentParameters p) {
        LinearImage src = Geometry.apply(input, p);
        final int w = src.width(), h = src.height();
        LinearImage out = LinearImage.blank(w, h);

        final float exposure = (float) Math.pow(2.0, p.globalExposure());
        final float contrast = p.contrast();
        final boolean applyContrast = Math.abs(contrast - 1f) >= CONTRAST_EPSILON;
        final boolean regions = hasRegionAdjustments(p);
        final float hl = p.highlights(), sh = p.shadows(), wh = p.whites(), bl = p.blacks();

        final float[] ir = src.r(), ig = src.g(), ib = src.b();
        final float[] or = out.r(), og = out.g(), ob = out.b();

        ParallelRows.forRows(h, (y0, y1) -> {
            for (int i = y0 * w; i < y1 * w; i++) {
                float r = ir[i] * exposure;
                float g = ig[i] * exposure;
                float b = ib[i] * exposure;

                if (applyContrast) {
                    r = contrast(r, contrast);
                    g = contrast(g, contrast);
                    b = contrast(b, contrast);
                }

                r = Math.max(0f, r);
                g = Math.max(0f, g);
                b = Math.max(0f, b);

                if (regions) {
                    float y = LinearImage.LUMA_R * r + LinearImage.LUMA_G * g + LinearImage.LUMA_B * b;
                    if (y > 0f) {
                        float scale = regionScale(y, hl, sh, wh, bl);
                        r *= scale;
                        g *= scale;
                        b *= scale;
                    }
                }

                or[i] = r;
                og[i] = g;
                ob[i] = b;
            }
        });
        return out;
    }

    static float contrast(float v, float m) {
        float c = (v - 0.5f) * m + 0.5f;
        return (c < 0f) ? 0f : (c > 1f) ? 1f : c;
    }

    /** Luminance multiplier produced by the region sliders for a pixel of luminance {@code y}. */
    static float regionScale(float y, float highlights, float shadows, float whites, float blacks) {
        float l = yToLstar(y);
        float wH = smoothstep(50f, 90f, l);
        float wS = 1f - smoothstep(10f, 50f, l);
        float wW = smoothstep(60f, 95f, l);
        float wB = 1f - smoothstep(5f, 40f, l);
        float delta = wH * highlights / 100f * 30f
                + wS * shadows / 100f * 30f
                + wW * whites / 200f * 20f
                + wB * blacks / 200f * 20f;
        if (delta == 0f)
            return 1f;
        float newL = Math.max(0f, Math.min(100f, l + delta));
        return lstarToY(newL) / y;
    }

    static float yToLstar(float y) {
        return y > EPSILON ? 116f * (float) Math.cbrt(y) - 16f : KAPPA * y;
    }

    static float lstarToY(float l) {
        if (l > KAPPA * EPSILON) {
            float f = (l + 16f) / 116f;
            return f * f * f;
        }
        return l / KAPPA;
    }

    static float smoothstep(float edge0, float edge1, float x) {
        float t = (x - edge0) / (edge1 - edge0);
        t = (t < 0f) ? 0f : (t > 1f) ? 1f : t;
        return t * t * (3f - 2f * t);
    }
}
