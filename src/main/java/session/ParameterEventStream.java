package session;

import params.AdjustmentParameters;

import java.util.function.Consumer;

/** Source of parameter snapshots, e.g. slider moves from a UI. */
public interface ParameterEventStream {

    /** @return a handle whose {@code close()} stops delivery */
    AutoCloseable subscribe(Consumer<AdjustmentParameters> listener);
}
