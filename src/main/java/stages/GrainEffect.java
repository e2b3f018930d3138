package stages;

/**
 * Film grain: additive per-channel hash noise, stronger in shadows and highlights than
 * in the midtones.
 */
public final class GrainEffect {

    public static final int DEFAULT_SEED = 12345;

    private GrainEffect() {
    }

    /** Deterministic noise in [-1, 1] for a pixel and seed. */
    public static float noise(int x, int y, int seed) {
        int h = seed;
        h ^= x * 374761393;
        h ^= y * 668265263;
        h = (h ^ (h >>> 13)) * 1274126177;
        h = h ^ (h >>> 16);
        return (h & 0xFFFFFF) / (float) 0xFFFFFF * 2f - 1f;
    }

    /** 0.5 at luminance 0.5, rising parabolically to 1.0 at black and white. */
    public static float luminanceWeight(float luminance) {
        float d = Math.abs(luminance - 0.5f) * 2f;
        return 0.5f + d * d * 0.5f;
    }

    /**
     * @param amount grain strength in [0,1]; values below 0.001 leave the pixel alone
     * @param px     RGB triple, modified in place
     */
    public static void apply(float[] px, float amount, int x, int y, int seed) {
        if (amount < 0.001f)
            return;
        float lum = 0.2126f * px[0] + 0.7152f * px[1] + 0.0722f * px[2];
        float strength = amount * 0.05f * luminanceWeight(lum);
        px[0] += noise(x, y, seed) * strength;
        px[1] += noise(x, y, seed + 1) * strength;
        px[2] += noise(x, y, seed + 2) * strength;
    }
}
