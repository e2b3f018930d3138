package cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * L1 previews, L2 stage outputs and the L3 source. Replacing or clearing a level clears the
 * levels derived from it.
 */
public final class CacheHierarchy {

    private static final Logger log = LoggerFactory.getLogger(CacheHierarchy.class);

    private final PreviewCache previews;
    private final StageCache stages;
    private final SourceSlot source = new SourceSlot();

    public CacheHierarchy(long l1MaxBytes, int l2MaxEntries, boolean verifyOnHit) {
        this.previews = new PreviewCache(l1MaxBytes);
        this.stages = new StageCache(l2MaxEntries, verifyOnHit);
    }

    public PreviewCache previews() {
        return previews;
    }

    public StageCache stages() {
        return stages;
    }

    public SourceSlot source() {
        return source;
    }

    /** New L3 source; everything derived from the old one goes. */
    public void replaceSource(SourceImage image) {
        SourceImage prev = source.replace(image);
        stages.clear();
        previews.clear();
        log.debug("Source replaced ({} -> {}), L2/L1 cleared", prev == null ? "none" : shortId(prev.id()),
                shortId(image.id()));
    }

    /** Drop L2 and L1, keep the source. */
    public void clearDerived() {
        stages.clear();
        previews.clear();
    }

    public void clearAll() {
        source.clear();
        clearDerived();
    }

    public CacheStats stats() {
        return new CacheStats(previews.size(), previews.bytes(), previews.hits(), previews.misses(),
                stages.size(), stages.bytes(), stages.hits(), stages.misses(), stages.evictions(),
                stages.corruptions(), source.get().isPresent());
    }

    private static String shortId(String id) {
        return id.substring(0, Math.min(12, id.length()));
    }
}
