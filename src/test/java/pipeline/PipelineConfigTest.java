package pipeline;

import org.junit.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PipelineConfigTest {

    @Test
    public void defaultsMatchDocumentedValues() {
        PipelineConfig c = PipelineConfig.defaults();
        assertTrue(c.cacheEnabled());
        assertEquals(50L * 1024 * 1024, c.l1MaxBytes());
        assertEquals(3, c.l2MaxEntries());
        assertEquals(List.of(1200, 800, 600), c.previewLadder());
        assertEquals(150, c.debounceMs());
        assertFalse(c.bilateral().enableGpu());
    }

    @Test
    public void classpathResourceLoads() {
        PipelineConfig c = PipelineConfig.load();
        assertTrue(c.incrementalEnabled());
        assertEquals(3, c.l2MaxEntries());
    }

    @Test
    public void parsesOverrides() {
        Properties p = new Properties();
        p.setProperty("cache.l2.maxEntries", "5");
        p.setProperty("preview.ladder", "1000, 500");
        p.setProperty("output.softClip", "true");
        p.setProperty("useGPU", "true");
        PipelineConfig c = PipelineConfig.fromProperties(p);
        assertEquals(5, c.l2MaxEntries());
        assertEquals(List.of(1000, 500), c.previewLadder());
        assertTrue(c.softClip());
        assertTrue(c.bilateral().enableGpu());
    }

    @Test
    public void invalidValuesKeepDefaults() {
        Properties p = new Properties();
        p.setProperty("cache.l2.maxEntries", "0");
        p.setProperty("cache.l1.maxBytes", "lots");
        p.setProperty("preview.ladder", "800,1200");
        p.setProperty("cache.enabled", "maybe");
        PipelineConfig c = PipelineConfig.fromProperties(p);
        assertEquals(PipelineConfig.DEFAULT_L2_ENTRIES, c.l2MaxEntries());
        assertEquals(PipelineConfig.DEFAULT_L1_BYTES, c.l1MaxBytes());
        assertEquals(PipelineConfig.DEFAULT_LADDER, c.previewLadder());
        assertTrue(c.cacheEnabled());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyLadderIsRejectedByTheBuilder() {
        PipelineConfig.builder().previewLadder(List.of()).build();
    }
}
