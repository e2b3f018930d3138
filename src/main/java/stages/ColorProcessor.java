package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;
import util.ParallelRows;

/**
 * White balance, saturation, vibrance, 8-band HSL and three-way color grading, in that order.
 */
public final class ColorProcessor implements StageProcessor {

    static final float EPS = 0.01f;

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.COLOR;
    }

    @Override
    public boolean shouldExecute(AdjustmentParameters p) {
        return hasWhiteBalance(p)
                || Math.abs(p.saturation() - 1f) > EPS
                || Math.abs(p.vibrance()) > EPS
                || hasHsl(p)
                || hasGrading(p);
    }

    private static boolean hasWhiteBalance(AdjustmentParameters p) {
        return Math.abs(p.temperature()) > EPS || Math.abs(p.tint()) > EPS;
    }

    private static boolean hasHsl(AdjustmentParameters p) {
        if (!p.enableHsl())
            return false;
        for (int i = 0; i < AdjustmentParameters.HSL_BANDS; i++) {
            if (p.hslHueShift().get(i) != 0f || p.hslSaturation().get(i) != 0f || p.hslLuminance().get(i) != 0f)
                return true;
        }
        return false;
    }

    private static boolean hasGrading(AdjustmentParameters p) {
        return p.gradingBlending() > 0f && (p.gradingHighlightsTemp() != 0f || p.gradingHighlightsTint() != 0f
                || p.gradingMidtonesTemp() != 0f || p.gradingMidtonesTint() != 0f
                || p.gradingShadowsTemp() != 0f || p.gradingShadowsTint() != 0f);
    }

    @Override
    public LinearImage process(LinearImage input, AdjustmentParameters p) {
        final int w = input.width();
        LinearImage out = input.copy();
        final float[] r = out.r(), g = out.g(), b = out.b();

        final boolean wb = hasWhiteBalance(p);
        final float[] wbGains = wb ? WhiteBalance.gains(p.temperature(), p.tint()) : null;
        final float saturation = p.saturation();
        final boolean sat = Math.abs(saturation - 1f) > EPS;
        final float vibrance = p.vibrance() / 100f;
        final boolean vib = Math.abs(p.vibrance()) > EPS;
        final boolean hsl = hasHsl(p);
        final float[] hue = AdjustmentParameters.toArray(p.hslHueShift());
        final float[] hslSat = AdjustmentParameters.toArray(p.hslSaturation());
        final float[] hslLum = AdjustmentParameters.toArray(p.hslLuminance());
        final boolean grading = hasGrading(p);
        final Grading grade = grading ? new Grading(p) : null;

        ParallelRows.forRows(input.height(), (y0, y1) -> {
            float[] px = new float[3];
            for (int i = y0 * w; i < y1 * w; i++) {
                px[0] = r[i];
                px[1] = g[i];
                px[2] = b[i];
                if (wb)
                    whiteBalance(px, wbGains);
                if (sat)
                    saturation(px, saturation);
                if (vib)
                    vibrance(px, vibrance);
                if (hsl)
                    hsl(px, hue, hslSat, hslLum);
                if (grading)
                    grade.apply(px);
                r[i] = px[0];
                g[i] = px[1];
                b[i] = px[2];
            }
        });
        return out;
    }

    /** Channel gains, then restore the original luminance. */
    static void whiteBalance(float[] px, float[] gains) {
        float before = luma(px);
        px[0] *= gains[0];
        px[1] *= gains[1];
        px[2] *= gains[2];
        float after = luma(px);
        if (after > 0.0001f && before > 0.0001f) {
            float s = before / after;
            px[0] *= s;
            px[1] *= s;
            px[2] *= s;
        }
        clampNonNegative(px);
    }

    static void saturation(float[] px, float factor) {
        float l = luma(px);
        for (int c = 0; c < 3; c++)
            px[c] = Math.max(0f, l + (px[c] - l) * factor);
    }

    /** Boost scaled by how unsaturated the pixel already is. */
    static void vibrance(float[] px, float amount) {
        float max = Math.max(px[0], Math.max(px[1], px[2]));
        float min = Math.min(px[0], Math.min(px[1], px[2]));
        float currentSat = max > 0f ? (max - min) / max : 0f;
        float factor = 1f + amount * (1f - currentSat);
        float avg = (px[0] + px[1] + px[2]) / 3f;
        for (int c = 0; c < 3; c++)
            px[c] = Math.max(0f, avg + (px[c] - avg) * factor);
    }

    /** Eight hard 45° hue bands starting at red; saturation and lightness shifts are additive. */
    static void hsl(float[] px, float[] hueShift, float[] satShift, float[] lumShift) {
        float[] hslv = rgbToHsl(px[0], px[1], px[2]);
        int band = Math.min(7, (int) (hslv[0] * 8f));
        float hh = hslv[0] + hueShift[band] / 360f;
        hh = hh - (float) Math.floor(hh);
        float ss = clamp01(hslv[1] + satShift[band] / 100f);
        float ll = clamp01(hslv[2] + lumShift[band] / 100f);
        hslToRgb(hh, ss, ll, px);
        for (int c = 0; c < 3; c++)
            px[c] = clamp01(px[c]);
    }

    static float[] rgbToHsl(float r, float g, float b) {
        float max = Math.max(r, Math.max(g, b));
        float min = Math.min(r, Math.min(g, b));
        float delta = max - min;
        float l = (max + min) / 2f;
        if (delta < 1e-5f)
            return new float[] { 0f, 0f, l };
        float s = l > 0.5f ? delta / (2f - max - min) : delta / (max + min);
        float h;
        if (max == r)
            h = (g - b) / delta + (g < b ? 6f : 0f);
        else if (max == g)
            h = (b - r) / delta + 2f;
        else
            h = (r - g) / delta + 4f;
        return new float[] { h / 6f, s, l };
    }

    static void hslToRgb(float h, float s, float l, float[] out) {
        if (s < 1e-5f) {
            out[0] = out[1] = out[2] = l;
            return;
        }
        float q = l < 0.5f ? l * (1f + s) : l + s - l * s;
        float p = 2f * l - q;
        out[0] = hueToChannel(p, q, h + 1f / 3f);
        out[1] = hueToChannel(p, q, h);
        out[2] = hueToChannel(p, q, h - 1f / 3f);
    }

    private static float hueToChannel(float p, float q, float t) {
        if (t < 0f)
            t += 1f;
        if (t > 1f)
            t -= 1f;
        if (t < 1f / 6f)
            return p + (q - p) * 6f * t;
        if (t < 0.5f)
            return q;
        if (t < 2f / 3f)
            return p + (q - p) * (2f / 3f - t) * 6f;
        return p;
    }

    /**
     * Shadows/midtones/highlights offsets in LMS cone space, weighted by normalized
     * Gaussians over luminance.
     */
    static final class Grading {
        final float balance;
        final float blending;
        final float[] shadow;
        final float[] mid;
        final float[] high;

        Grading(AdjustmentParameters p) {
            balance = p.gradingBalance() / 100f;
            blending = p.gradingBlending() / 100f;
            shadow = offsets(p.gradingShadowsTemp(), p.gradingShadowsTint());
            mid = offsets(p.gradingMidtonesTemp(), p.gradingMidtonesTint());
            high = offsets(p.gradingHighlightsTemp(), p.gradingHighlightsTint());
        }

        static float[] offsets(float temp, float tint) {
            return new float[] { temp * 0.01f, tint * 0.01f, -temp * 0.005f };
        }

        /** Normalized {shadow, midtone, highlight} weights. */
        static float[] weights(float luminance, float balance) {
            float sw = gaussian(luminance, 0.2f + balance * 0.15f, 0.25f);
            float mw = gaussian(luminance, 0.5f + balance * 0.1f, 0.3f);
            float hw = gaussian(luminance, 0.8f + balance * 0.15f, 0.25f);
            float total = sw + mw + hw;
            if (total > 0f)
                return new float[] { sw / total, mw / total, hw / total };
            return new float[] { 0f, 1f, 0f };
        }

        private static float gaussian(float x, float center, float width) {
            float d = x - center;
            return (float) Math.exp(-(d * d) / (2f * width * width));
        }

        void apply(float[] px) {
            float lum = clamp01(luma(px));
            float[] wt = weights(lum, balance);
            float r = px[0], g = px[1], b = px[2];
            float l = 0.4002f * r + 0.7075f * g - 0.0807f * b;
            float m = -0.2280f * r + 1.1500f * g + 0.0612f * b;
            float s = 0.9184f * b;
            l += (wt[0] * shadow[0] + wt[1] * mid[0] + wt[2] * high[0]) * blending;
            m += (wt[0] * shadow[1] + wt[1] * mid[1] + wt[2] * high[1]) * blending;
            s += (wt[0] * shadow[2] + wt[1] * mid[2] + wt[2] * high[2]) * blending;
            px[0] = Math.max(0f, 1.8599f * l - 1.1294f * m + 0.2198f * s);
            px[1] = Math.max(0f, 0.3611f * l + 0.6388f * m);
            px[2] = Math.max(0f, 1.0890f * s);
        }
    }

    static float luma(float[] px) {
        return LinearImage.LUMA_R * px[0] + LinearImage.LUMA_G * px[1] + LinearImage.LUMA_B * px[2];
    }

    private static void clampNonNegative(float[] px) {
        for (int c = 0; c < 3; c++)
            px[c] = Math.max(0f, px[c]);
    }

    private static float clamp01(float v) {
        return (v < 0f) ? 0f : (v > 1f) ? 1f : v;
    }
}
