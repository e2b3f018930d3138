package stages;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Usage counters for the bilateral dispatcher, kept for threshold tuning.
 */
public final class BilateralStats {

    /** Immutable copy of the counters at one moment. */
    public record Snapshot(long totalCalls, long standardCalls, long fastApproxCalls, long gpuCalls,
            long gpuFallbacks, long cacheHits, long cacheMisses, double averageTimeMs) {

        public double cacheHitRate() {
            long lookups = cacheHits + cacheMisses;
            return lookups == 0 ? 0.0 : (double) cacheHits / lookups;
        }

        @Override
        public String toString() {
            return String.format(java.util.Locale.ROOT,
                    "calls=%d (standard=%d fast=%d gpu=%d, gpuFallbacks=%d) cache=%d/%d hit avg=%.2f ms",
                    totalCalls, standardCalls, fastApproxCalls, gpuCalls, gpuFallbacks, cacheHits,
                    cacheHits + cacheMisses, averageTimeMs);
        }
    }

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong standardCalls = new AtomicLong();
    private final AtomicLong fastApproxCalls = new AtomicLong();
    private final AtomicLong gpuCalls = new AtomicLong();
    private final AtomicLong gpuFallbacks = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();

    void recordCall(String path, long nanos) {
        totalCalls.incrementAndGet();
        totalNanos.addAndGet(nanos);
        switch (path) {
            case GpuBilateral.NAME -> gpuCalls.incrementAndGet();
            case BilateralFast.NAME -> fastApproxCalls.incrementAndGet();
            default -> standardCalls.incrementAndGet();
        }
    }

    void recordCacheHit(long nanos) {
        totalCalls.incrementAndGet();
        totalNanos.addAndGet(nanos);
        cacheHits.incrementAndGet();
    }

    void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    void recordGpuFallback() {
        gpuFallbacks.incrementAndGet();
    }

    public Snapshot snapshot() {
        long calls = totalCalls.get();
        double avg = calls == 0 ? 0.0 : totalNanos.get() / 1e6 / calls;
        return new Snapshot(calls, standardCalls.get(), fastApproxCalls.get(), gpuCalls.get(), gpuFallbacks.get(),
                cacheHits.get(), cacheMisses.get(), avg);
    }

    public void reset() {
        totalCalls.set(0);
        standardCalls.set(0);
        fastApproxCalls.set(0);
        gpuCalls.set(0);
        gpuFallbacks.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        totalNanos.set(0);
    }
}
