package pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation, checked by the orchestrator between stages. */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** A token nobody cancels. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this != NONE)
            cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
