package stages;

/**
 * Dispatch policy for {@link BilateralDispatcher}.
 *
 * @param fastApproxThreshold spatial sigma at or above which the downsampling path is used
 * @param gpuThresholdPixels  pixel count at or above which the GPU path is tried
 */
public record BilateralConfig(boolean enableCache,
        int maxCacheEntries,
        long maxCacheMemoryMb,
        boolean enableFastApproximation,
        float fastApproxThreshold,
        boolean enableGpu,
        long gpuThresholdPixels) {

    public static final int DEFAULT_CACHE_ENTRIES = 100;
    public static final long DEFAULT_CACHE_MEMORY_MB = 512;
    public static final float DEFAULT_FAST_THRESHOLD = 4.5f;
    public static final long DEFAULT_GPU_THRESHOLD = 1_500_000L;

    static final long MIN_GPU_THRESHOLD = 100_000L;
    static final long MAX_GPU_THRESHOLD = 100_000_000L;

    public static BilateralConfig defaults() {
        return new BilateralConfig(true, DEFAULT_CACHE_ENTRIES, DEFAULT_CACHE_MEMORY_MB,
                true, DEFAULT_FAST_THRESHOLD, false, DEFAULT_GPU_THRESHOLD);
    }

    /** Out-of-range values replaced by their defaults. */
    public BilateralConfig validated() {
        float fast = (Float.isNaN(fastApproxThreshold) || fastApproxThreshold < 0f || fastApproxThreshold > 100f)
                ? DEFAULT_FAST_THRESHOLD
                : fastApproxThreshold;
        long gpu = (gpuThresholdPixels < MIN_GPU_THRESHOLD || gpuThresholdPixels > MAX_GPU_THRESHOLD)
                ? DEFAULT_GPU_THRESHOLD
                : gpuThresholdPixels;
        int entries = maxCacheEntries > 0 ? maxCacheEntries : DEFAULT_CACHE_ENTRIES;
        long mem = maxCacheMemoryMb > 0 ? maxCacheMemoryMb : DEFAULT_CACHE_MEMORY_MB;
        return new BilateralConfig(enableCache, entries, mem, enableFastApproximation, fast, enableGpu, gpu);
    }

    public BilateralConfig withGpu(boolean enabled) {
        return new BilateralConfig(enableCache, maxCacheEntries, maxCacheMemoryMb, enableFastApproximation,
                fastApproxThreshold, enabled, gpuThresholdPixels);
    }

    public BilateralConfig withCache(boolean enabled) {
        return new BilateralConfig(enabled, maxCacheEntries, maxCacheMemoryMb, enableFastApproximation,
                fastApproxThreshold, enableGpu, gpuThresholdPixels);
    }

    public BilateralConfig withFastApproximation(boolean enabled, float threshold) {
        return new BilateralConfig(enableCache, maxCacheEntries, maxCacheMemoryMb, enabled, threshold, enableGpu,
                gpuThresholdPixels);
    }
}
