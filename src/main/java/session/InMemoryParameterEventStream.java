package session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import params.AdjustmentParameters;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** Synchronous fan-out to every subscriber, in subscription order. */
public final class InMemoryParameterEventStream implements ParameterEventStream {

    private static final Logger log = LoggerFactory.getLogger(InMemoryParameterEventStream.class);

    private final List<Consumer<AdjustmentParameters>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public AutoCloseable subscribe(Consumer<AdjustmentParameters> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(AdjustmentParameters params) {
        for (Consumer<AdjustmentParameters> l : listeners) {
            try {
                l.accept(params);
            } catch (RuntimeException e) {
                log.warn("Parameter listener failed: {}", e.toString());
            }
        }
    }

    public int subscribers() {
        return listeners.size();
    }
}
