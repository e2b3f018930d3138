package pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered phases of the adjustment chain. Declaration order is processing order.
 */
public enum ProcessingStage {

    TONE_BASE(1, false, 5),
    CURVES(2, false, 3),
    COLOR(3, false, 8),
    EFFECTS(4, true, 25),
    DETAILS(5, true, 30);

    private final int order;
    private final boolean shouldCache;
    private final long estimatedTimeMs;

    ProcessingStage(int order, boolean shouldCache, long estimatedTimeMs) {
        this.order = order;
        this.shouldCache = shouldCache;
        this.estimatedTimeMs = estimatedTimeMs;
    }

    public int order() {
        return order;
    }

    public boolean shouldCache() {
        return shouldCache;
    }

    public long estimatedTimeMs() {
        return estimatedTimeMs;
    }

    /** The stage that feeds this one, or null for the first stage. */
    public ProcessingStage previous() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    public ProcessingStage next() {
        ProcessingStage[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
    }

    public static List<ProcessingStage> ordered() {
        return Collections.unmodifiableList(Arrays.asList(values()));
    }

    /** Contiguous suffix of the stage order starting at {@code start}. */
    public static List<ProcessingStage> from(ProcessingStage start) {
        List<ProcessingStage> out = new ArrayList<>();
        for (ProcessingStage s : values()) {
            if (s.order >= start.order)
                out.add(s);
        }
        return Collections.unmodifiableList(out);
    }
}
