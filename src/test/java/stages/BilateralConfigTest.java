package stages;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class BilateralConfigTest {

    @Test
    public void outOfRangeValuesFallBackToDefaults() {
        BilateralConfig c = new BilateralConfig(true, 0, -1, true, 250f, true, 10).validated();
        assertEquals(BilateralConfig.DEFAULT_CACHE_ENTRIES, c.maxCacheEntries());
        assertEquals(BilateralConfig.DEFAULT_CACHE_MEMORY_MB, c.maxCacheMemoryMb());
        assertEquals(BilateralConfig.DEFAULT_FAST_THRESHOLD, c.fastApproxThreshold(), 0f);
        assertEquals(BilateralConfig.DEFAULT_GPU_THRESHOLD, c.gpuThresholdPixels());
    }

    @Test
    public void validValuesAreKept() {
        BilateralConfig c = new BilateralConfig(false, 10, 64, true, 6f, false, 200_000).validated();
        assertEquals(10, c.maxCacheEntries());
        assertEquals(6f, c.fastApproxThreshold(), 0f);
        assertEquals(200_000, c.gpuThresholdPixels());
    }
}
