package stages;

/**
 * Temperature/tint channel gains relative to a 6500 K reference, derived from the
 * Planckian locus (Kim et al. cubic fit) and sRGB primaries.
 */
final class WhiteBalance {

    static final float BASE_TEMPERATURE = 6500f;
    static final float MIN_TARGET = 2000f;
    static final float MAX_TARGET = 10000f;

    private WhiteBalance() {
    }

    /** Per-channel gains {r, g, b} for both sliders combined. */
    static float[] gains(float temperatureShift, float tintShift) {
        float[] t = Math.abs(temperatureShift) > 0.01f ? temperatureScale(temperatureShift) : new float[] { 1f, 1f, 1f };
        float[] n = Math.abs(tintShift) > 0.01f ? tintScale(tintShift) : new float[] { 1f, 1f, 1f };
        return new float[] { t[0] * n[0], t[1] * n[1], t[2] * n[2] };
    }

    static float targetTemperature(float shift) {
        float target;
        if (shift < 0f) {
            float t = -shift / 100f;
            double logBase = Math.log(BASE_TEMPERATURE);
            double logMin = Math.log(MIN_TARGET);
            target = (float) Math.exp(logBase + t * (logMin - logBase));
        } else {
            float t = shift / 100f;
            target = BASE_TEMPERATURE + t * (MAX_TARGET - BASE_TEMPERATURE);
        }
        return clamp(target, 1000f, 100000f);
    }

    static float[] temperatureScale(float shift) {
        float[] base = normalizedRgb(BASE_TEMPERATURE);
        float[] target = normalizedRgb(targetTemperature(shift));
        float[] s = new float[3];
        for (int c = 0; c < 3; c++) {
            s[c] = base[c] > 0.0001f ? target[c] / base[c] : 1f;
            s[c] = clamp(s[c], 0.3f, 3f);
        }
        return s;
    }

    static float[] tintScale(float shift) {
        float t = shift / 100f;
        float rb, g;
        if (t < 0f) {
            rb = 1f + t * 0.3f;
            g = 1f - t * 0.5f;
        } else {
            rb = 1f + t * 0.4f;
            g = 1f - t * 0.5f;
        }
        rb = clamp(rb, 0.7f, 1.5f);
        g = clamp(g, 0.5f, 1.5f);
        return new float[] { rb, g, rb };
    }

    /** Linear RGB of a blackbody at {@code kelvin}, scaled to unit luminance. */
    private static float[] normalizedRgb(float kelvin) {
        float[] xy = cieXy(kelvin);
        float x = xy[0], y = xy[1];
        float bigY = 1f;
        float bigX = y > 0.0001f ? bigY * x / y : 0f;
        float bigZ = y > 0.0001f ? bigY * (1f - x - y) / y : 0f;
        float r = 3.2406f * bigX - 1.5372f * bigY - 0.4986f * bigZ;
        float g = -0.9689f * bigX + 1.8758f * bigY + 0.0415f * bigZ;
        float b = 0.0557f * bigX - 0.2040f * bigY + 1.0570f * bigZ;
        float lum = 0.2126f * r + 0.7152f * g + 0.0722f * b;
        if (lum > 0.0001f) {
            r /= lum;
            g /= lum;
            b /= lum;
        }
        return new float[] { r, g, b };
    }

    /** Chromaticity of the Planckian locus, with smoothstep blends across the fit segments. */
    static float[] cieXy(float kelvin) {
        float t = clamp(kelvin, 1000f, 100000f);
        float t2 = t * t, t3 = t2 * t;
        float xLow = -0.2661239e9f / t3 - 0.2343589e6f / t2 + 0.8776956e3f / t + 0.179910f;
        float xMid = -4.6070e9f / t3 + 2.9678e6f / t2 + 0.09911e3f / t + 0.244063f;
        float xHigh = -2.0064e9f / t3 + 1.9018e6f / t2 + 0.24748e3f / t + 0.237040f;

        float x;
        if (t <= 4000f)
            x = xLow;
        else if (t < 4500f)
            x = mix(xLow, xMid, smooth((t - 4000f) / 500f));
        else if (t < 7000f)
            x = xMid;
        else if (t < 8000f)
            x = mix(xMid, xHigh, smooth((t - 7000f) / 1000f));
        else
            x = xHigh;

        float x2 = x * x, x3 = x2 * x;
        float yA = -1.1063814f * x3 - 1.34811020f * x2 + 2.18555832f * x - 0.20219683f;
        float yB = -0.9549476f * x3 - 1.37418593f * x2 + 2.09137015f * x - 0.16748867f;
        float yC = -3.000f * x2 + 2.870f * x - 0.275f;
        float yD = -2.400f * x2 + 2.600f * x - 0.239f;

        float y;
        if (t <= 2222f)
            y = yA;
        else if (t < 3000f)
            y = mix(yA, yB, smooth((t - 2222f) / (3000f - 2222f)));
        else if (t < 4000f)
            y = yB;
        else if (t < 5000f)
            y = mix(yB, yC, smooth((t - 4000f) / 1000f));
        else if (t < 7000f)
            y = yC;
        else
            y = yD;

        return new float[] { clamp(x, 0f, 1f), clamp(y, 0f, 1f) };
    }

    private static float smooth(float t) {
        return t * t * (3f - 2f * t);
    }

    private static float mix(float a, float b, float t) {
        return a * (1f - t) + b * t;
    }

    private static float clamp(float v, float lo, float hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }
}
