package pipeline;

/** Lifecycle of the most recent render on an orchestrator. */
public enum RenderState {
    IDLE, PLAN_BUILT, EXECUTING, DONE, FAILED, CANCELLED
}
