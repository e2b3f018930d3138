package image;

/**
 * Final linear-to-display conversion of a render.
 */
public final class OutputConverter {

    static final float SOFT_CLIP_THRESHOLD = 0.8f;
    static final float SOFT_CLIP_KNEE = 0.15f;

    private OutputConverter() {
    }

    public static Rgba8Buffer linearToOutput(LinearImage img, boolean dither) {
        return linearToOutput(img, dither, false);
    }

    /**
     * @param dither    Floyd–Steinberg at 8 bits instead of truncation
     * @param softClip  roll highlights off above 0.8 instead of hard clipping
     */
    public static Rgba8Buffer linearToOutput(LinearImage img, boolean dither, boolean softClip) {
        LinearImage src = softClip ? softClip(img) : img;
        if (dither)
            return Dithering.toRgba8(src);

        int n = src.pixelCount();
        float[] r = src.r(), g = src.g(), b = src.b();
        byte[] data = new byte[n * 4];
        for (int i = 0; i < n; i++) {
            data[i * 4] = (byte) (int) (ColorSpace.linearToSrgb(r[i]) * 255f);
            data[i * 4 + 1] = (byte) (int) (ColorSpace.linearToSrgb(g[i]) * 255f);
            data[i * 4 + 2] = (byte) (int) (ColorSpace.linearToSrgb(b[i]) * 255f);
            data[i * 4 + 3] = (byte) 0xFF;
        }
        return new Rgba8Buffer(src.width(), src.height(), data);
    }

    public static LinearImage softClip(LinearImage img) {
        LinearImage out = LinearImage.blank(img.width(), img.height());
        float[][] in = { img.r(), img.g(), img.b() };
        float[][] dst = { out.r(), out.g(), out.b() };
        for (int c = 0; c < 3; c++) {
            float[] s = in[c], d = dst[c];
            for (int i = 0; i < s.length; i++)
                d[i] = softClip(s[i]);
        }
        return out;
    }

    /**
     * Identity below the threshold; a Hermite blend through the knee; beyond the knee a
     * tanh shoulder that approaches 1.
     */
    public static float softClip(float v) {
        if (v <= SOFT_CLIP_THRESHOLD)
            return Math.max(0f, v);
        float kneeEnd = SOFT_CLIP_THRESHOLD + SOFT_CLIP_KNEE;
        float headroom = 1f - SOFT_CLIP_THRESHOLD;
        float shoulder = SOFT_CLIP_THRESHOLD + headroom * (float) Math.tanh((v - SOFT_CLIP_THRESHOLD) / headroom);
        if (v >= kneeEnd)
            return shoulder;
        float t = (v - SOFT_CLIP_THRESHOLD) / SOFT_CLIP_KNEE;
        float blend = t * t * (3f - 2f * t);
        return v * (1f - blend) + shoulder * blend;
    }
}
