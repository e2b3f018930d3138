package image;

/**
 * sRGB transfer functions (IEC 61966-2-1).
 */
public final class ColorSpace {

    private ColorSpace() {
    }

    public static float linearToSrgb(float v) {
        v = clamp01(v);
        if (v <= 0.0031308f)
            return 12.92f * v;
        return (float) (1.055 * Math.pow(v, 1.0 / 2.4) - 0.055);
    }

    public static float srgbToLinear(float s) {
        s = clamp01(s);
        if (s <= 0.04045f)
            return s / 12.92f;
        return (float) Math.pow((s + 0.055) / 1.055, 2.4);
    }

    /** 8-bit sRGB code value to linear, via a 256-entry table. */
    public static float srgb8ToLinear(int v) {
        return SRGB8_TO_LINEAR[v & 0xFF];
    }

    public static LinearImage toSrgb(LinearImage img) {
        LinearImage out = LinearImage.blank(img.width(), img.height());
        convert(img.r(), out.r(), true);
        convert(img.g(), out.g(), true);
        convert(img.b(), out.b(), true);
        return out;
    }

    public static LinearImage toLinear(LinearImage srgb) {
        LinearImage out = LinearImage.blank(srgb.width(), srgb.height());
        convert(srgb.r(), out.r(), false);
        convert(srgb.g(), out.g(), false);
        convert(srgb.b(), out.b(), false);
        return out;
    }

    private static void convert(float[] in, float[] out, boolean encode) {
        for (int i = 0; i < in.length; i++)
            out[i] = encode ? linearToSrgb(in[i]) : srgbToLinear(in[i]);
    }

    static float clamp01(float v) {
        return (v < 0f) ? 0f : (v > 1f) ? 1f : v;
    }

    private static final float[] SRGB8_TO_LINEAR = new float[256];

    static {
        for (int i = 0; i < 256; i++)
            SRGB8_TO_LINEAR[i] = srgbToLinear(i / 255.0f);
    }
}
