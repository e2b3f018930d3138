package hw;

import image.LinearImage;

/**
 * Soft heap cap for stage allocations. A render asks before each stage whether one more
 * working image fits; if not, the orchestrator steps down the preview ladder.
 */
public class MemoryGuard {
    // Soft cap as a fraction of *free* heap at construction
    private final long softCapBytes;
    private final long allocationOverheadBytes;

    public MemoryGuard(double fractionOfFree, long allocationOverheadBytes) {
        long freeAtStart = maxHeap() - usedHeap();
        if (freeAtStart <= 0)
            freeAtStart = 256L * 1024 * 1024; // fallback 256MB
        this.softCapBytes = (long) Math.max(64L * 1024 * 1024, freeAtStart * fractionOfFree); // at least 64MB
        this.allocationOverheadBytes = allocationOverheadBytes;
    }

    /** Fixed cap, mostly for tests. */
    public static MemoryGuard withSoftCap(long softCapBytes) {
        return new MemoryGuard(softCapBytes);
    }

    private MemoryGuard(long softCapBytes) {
        this.softCapBytes = softCapBytes;
        this.allocationOverheadBytes = 0;
    }

    public static MemoryGuard defaults() {
        return new MemoryGuard(0.75, 1024 * 1024);
    }

    /**
     * True when allocating {@code bytesNeeded} more would cross the soft cap or exceed
     * what the heap can still hand out.
     */
    public boolean underPressure(long bytesNeeded) {
        long predicted = bytesNeeded + allocationOverheadBytes;
        if (predicted > softCapBytes)
            return true;
        return predicted > maxHeap() - usedHeap();
    }

    /** Pressure check for one more working image of the given size. */
    public boolean underPressure(int width, int height) {
        return underPressure(LinearImage.estimateBytes(width, height));
    }

    public long getSoftCapBytes() {
        return softCapBytes;
    }

    private static long maxHeap() {
        return Runtime.getRuntime().maxMemory();
    }

    private static long usedHeap() {
        Runtime rt = Runtime.getRuntime();
        return rt.totalMemory() - rt.freeMemory();
    }
}
