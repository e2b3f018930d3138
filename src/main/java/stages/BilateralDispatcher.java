package stages;

import image.LinearImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a bilateral implementation per call.
 *
 * Order: result cache, then GPU (enabled, large enough, available), then the fast
 * approximation (enabled, σs at or above the threshold), then the reference filter.
 * A GPU failure is retried once on the CPU path and never reaches the caller.
 */
public final class BilateralDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BilateralDispatcher.class);

    private final BilateralFilter standard;
    private final BilateralFilter fast;
    private final BilateralFilter gpu;
    private final BilateralStats stats = new BilateralStats();

    private volatile BilateralConfig config;
    private volatile BilateralResultCache cache;

    public BilateralDispatcher(BilateralConfig config) {
        this(config, new BilateralStandard(), new BilateralFast(), new GpuBilateral());
    }

    public BilateralDispatcher(BilateralConfig config, BilateralFilter standard, BilateralFilter fast,
            BilateralFilter gpu) {
        this.standard = standard;
        this.fast = fast;
        this.gpu = gpu;
        setConfig(config);
    }

    public void setConfig(BilateralConfig config) {
        BilateralConfig valid = config.validated();
        this.config = valid;
        this.cache = new BilateralResultCache(valid.maxCacheEntries(), valid.maxCacheMemoryMb());
    }

    public BilateralConfig config() {
        return config;
    }

    public BilateralStats stats() {
        return stats;
    }

    public void clearCache() {
        cache.clear();
    }

    /** The implementation the policy selects for an image of this size, ignoring the cache. */
    public BilateralFilter select(int pixelCount, float spatialSigma) {
        BilateralConfig c = config;
        if (c.enableGpu() && pixelCount >= c.gpuThresholdPixels() && gpu.isAvailable())
            return gpu;
        return cpuPath(c, spatialSigma);
    }

    private BilateralFilter cpuPath(BilateralConfig c, float spatialSigma) {
        if (c.enableFastApproximation() && spatialSigma >= c.fastApproxThreshold())
            return fast;
        return standard;
    }

    public LinearImage filter(LinearImage image, float spatialSigma, float rangeSigma) {
        if (!(spatialSigma > 0f) || !(rangeSigma > 0f))
            throw new IllegalArgumentException("sigmas must be positive: spatial=" + spatialSigma
                    + " range=" + rangeSigma);
        BilateralConfig c = config;
        BilateralResultCache rc = cache;
        long t0 = System.nanoTime();

        BilateralResultCache.Key key = null;
        if (c.enableCache()) {
            key = BilateralResultCache.keyFor(image, spatialSigma, rangeSigma);
            LinearImage hit = rc.get(key);
            if (hit != null) {
                stats.recordCacheHit(System.nanoTime() - t0);
                return hit;
            }
            stats.recordCacheMiss();
        }

        BilateralFilter chosen = select(image.pixelCount(), spatialSigma);
        LinearImage out;
        try {
            out = chosen.apply(image, spatialSigma, rangeSigma);
        } catch (KernelException e) {
            if (chosen != gpu)
                throw e;
            stats.recordGpuFallback();
            if (gpu instanceof GpuBilateral g)
                g.markUnavailable();
            log.warn("GPU bilateral failed, retrying on CPU: {}", e.getMessage());
            chosen = cpuPath(c, spatialSigma);
            out = chosen.apply(image, spatialSigma, rangeSigma);
        }

        long nanos = System.nanoTime() - t0;
        stats.recordCall(chosen.name(), nanos);
        if (log.isDebugEnabled())
            log.debug("bilateral {}x{} σs={} σr={} via {} in {} ms", image.width(), image.height(), spatialSigma,
                    rangeSigma, chosen.name(), nanos / 1_000_000);
        if (key != null)
            rc.put(key, out);
        return out;
    }

    /** Detail layer: input minus its bilateral-smoothed base. May be negative. */
    public LinearImage extractDetail(LinearImage image, float spatialSigma, float rangeSigma) {
        LinearImage base = filter(image, spatialSigma, rangeSigma);
        LinearImage detail = LinearImage.blank(image.width(), image.height());
        float[][] in = { image.r(), image.g(), image.b() };
        float[][] bs = { base.r(), base.g(), base.b() };
        float[][] out = { detail.r(), detail.g(), detail.b() };
        for (int c = 0; c < 3; c++) {
            for (int i = 0; i < in[c].length; i++)
                out[c][i] = in[c][i] - bs[c][i];
        }
        return detail;
    }
}
