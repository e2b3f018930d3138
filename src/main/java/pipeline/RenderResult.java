package pipeline;

import image.Rgba8Buffer;

import java.util.List;

/**
 * Outcome of one render request.
 *
 * @param output         the new preview, or for failed and cancelled renders the last good one
 *                       (may be {@code null} if nothing was ever rendered)
 * @param plannedStages  the stages the plan asked for
 * @param executedStages stages that actually ran a kernel; may start earlier than the plan
 *                       when no cached seed was available
 */
public record RenderResult(Status status,
        Rgba8Buffer output,
        ProcessingPlan plan,
        List<ProcessingStage> plannedStages,
        List<ProcessingStage> executedStages,
        List<ProcessingStage> skippedStages,
        List<StageExecutionResult> stageResults,
        long cacheHits,
        long cacheMisses,
        long elapsedMs,
        boolean fromCache,
        int previewEdge,
        ErrorKind errorKind,
        String errorMessage) {

    public enum Status {
        SUCCESS, NOOP, FAILED, CANCELLED
    }

    public RenderResult {
        plannedStages = List.copyOf(plannedStages);
        executedStages = List.copyOf(executedStages);
        skippedStages = List.copyOf(skippedStages);
        stageResults = List.copyOf(stageResults);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS || status == Status.NOOP;
    }

    /** For FAILED and CANCELLED results the output is the last good preview. */
    public Rgba8Buffer lastGoodOutput() {
        return output;
    }

    static RenderResult failed(ErrorKind kind, String message, Rgba8Buffer lastGood, ProcessingPlan plan,
                               List<ProcessingStage> executed, List<StageExecutionResult> stageResults,
                               long elapsedMs, int previewEdge) {
        return new RenderResult(Status.FAILED, lastGood, plan,
                plan == null ? List.of() : plan.stagesToExecute(), executed, List.of(), stageResults, 0, 0,
                elapsedMs, false, previewEdge, kind, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Render[").append(status);
        if (errorKind != null)
            sb.append(' ').append(errorKind).append(": ").append(errorMessage);
        sb.append(" executed=").append(executedStages)
                .append(" hits=").append(cacheHits).append(" misses=").append(cacheMisses)
                .append(" edge=").append(previewEdge)
                .append(' ').append(elapsedMs).append("ms");
        if (fromCache)
            sb.append(" (cached)");
        return sb.append(']').toString();
    }
}
