package stages;

/**
 * Radial vignette. Untouched inside 60% of the normalized center distance, then a cubic
 * smoothstep falloff out to the corners.
 */
public final class VignetteEffect {

    public static final float FALLOFF_START = 0.6f;

    private VignetteEffect() {
    }

    /** Distance from the center pixel, 0 at the center and 1 at the corner pixels. */
    public static float normalizedDistance(int x, int y, int width, int height) {
        float cx = (width - 1) / 2f, cy = (height - 1) / 2f;
        float dx = (x - cx) / Math.max(cx, 0.5f);
        float dy = (y - cy) / Math.max(cy, 0.5f);
        return (float) Math.sqrt(dx * dx + dy * dy) / (float) Math.sqrt(2.0);
    }

    /** 1 inside the start radius, falling smoothly to 0 at distance 1. */
    public static float falloff(float distance) {
        if (distance <= FALLOFF_START)
            return 1f;
        float t = Math.min(1f, (distance - FALLOFF_START) / (1f - FALLOFF_START));
        return 1f - t * t * (3f - 2f * t);
    }

    /**
     * Pixel multiplier. Positive amounts darken the edges, negative amounts brighten them.
     *
     * @param amount slider value scaled to [-1, 1]
     */
    public static float strength(float distance, float amount) {
        float f = falloff(distance);
        if (amount >= 0f)
            return 1f - (1f - f) * Math.abs(amount);
        return 1f + (1f - f) * Math.abs(amount);
    }
}
