package pipeline;

/** What happened to one stage during a render. */
public record StageExecutionResult(ProcessingStage stage, Outcome outcome, long elapsedMicros) {

    public enum Outcome {
        EXECUTED,
        /** Output taken from the stage cache. */
        CACHE_HIT,
        /** All parameters neutral; input passed through. */
        PASSTHROUGH,
        FAILED
    }

    public double elapsedMs() {
        return elapsedMicros / 1000.0;
    }
}
