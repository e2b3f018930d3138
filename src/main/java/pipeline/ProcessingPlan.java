package pipeline;

import params.ParameterName;
import params.StageParameterMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered execution plan for one render request. Computed fresh per request.
 *
 * @param startStage      first stage to run, null for an empty plan
 * @param stagesToExecute contiguous suffix of the stage order from {@code startStage}
 * @param stagesToCache   executed stages whose output is worth keeping
 * @param skippedStages   every stage not executed
 */
public record ProcessingPlan(ProcessingStage startStage,
        List<ProcessingStage> stagesToExecute,
        List<ProcessingStage> stagesToCache,
        List<ProcessingStage> skippedStages,
        long estimatedTotalTimeMs,
        boolean isFullProcessing) {

    public ProcessingPlan {
        stagesToExecute = List.copyOf(stagesToExecute);
        stagesToCache = List.copyOf(stagesToCache);
        skippedStages = List.copyOf(skippedStages);
    }

    public static ProcessingPlan fullProcessing() {
        return build(ProcessingStage.TONE_BASE, true);
    }

    public static ProcessingPlan incrementalProcessing(Collection<ParameterName> changedFields) {
        ProcessingStage start = StageParameterMapping.earliestStage(
                StageParameterMapping.affectedStages(changedFields));
        return build(start, false);
    }

    /** Plan that re-runs everything from {@code start}; null gives an empty plan. */
    public static ProcessingPlan fromStage(ProcessingStage start) {
        return build(start, start == ProcessingStage.TONE_BASE);
    }

    public static ProcessingPlan empty() {
        return build(null, false);
    }

    public static long estimateProcessingTime(Collection<ParameterName> changedFields) {
        return incrementalProcessing(changedFields).estimatedTotalTimeMs();
    }

    private static ProcessingPlan build(ProcessingStage start, boolean full) {
        List<ProcessingStage> execute = StageParameterMapping.stagesFrom(start);
        List<ProcessingStage> cache = new ArrayList<>();
        List<ProcessingStage> skipped = new ArrayList<>();
        long estimate = 0;
        for (ProcessingStage s : ProcessingStage.values()) {
            if (execute.contains(s)) {
                estimate += s.estimatedTimeMs();
                if (s.shouldCache())
                    cache.add(s);
            } else {
                skipped.add(s);
            }
        }
        return new ProcessingPlan(start, execute, cache, skipped, estimate, full);
    }

    public boolean isEmpty() {
        return stagesToExecute.isEmpty();
    }

    public boolean shouldCache(ProcessingStage stage) {
        return stagesToCache.contains(stage);
    }

    @Override
    public String toString() {
        if (isEmpty())
            return "Plan[no-op]";
        return "Plan[" + (isFullProcessing ? "full" : "incremental") + " start=" + startStage
                + " run=" + stagesToExecute + " skip=" + skippedStages + " est=" + estimatedTotalTimeMs + "ms]";
    }
}
