package pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import params.AdjustmentParameters;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Debounces parameter edits onto one background render thread. A new submission cancels
 * the render in flight and restarts the debounce window, so a burst of slider moves renders
 * only the last snapshot.
 */
public final class RenderScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RenderScheduler.class);

    private final PipelineOrchestrator orchestrator;
    private final long debounceMs;
    private final Supplier<RenderOptions> options;
    private final Consumer<RenderResult> listener;
    private final ScheduledExecutorService exec;
    private final AtomicInteger rendersStarted = new AtomicInteger();

    // guarded by this
    private AdjustmentParameters latest;
    private ScheduledFuture<?> pending;
    private CancellationToken inFlight;

    public RenderScheduler(PipelineOrchestrator orchestrator, Consumer<RenderResult> listener) {
        this(orchestrator, orchestrator.config().debounceMs(), () -> RenderOptions.from(orchestrator.config()),
                listener);
    }

    public RenderScheduler(PipelineOrchestrator orchestrator, long debounceMs, Supplier<RenderOptions> options,
                           Consumer<RenderResult> listener) {
        if (debounceMs < 0)
            throw new IllegalArgumentException("debounceMs must be >= 0: " + debounceMs);
        this.orchestrator = orchestrator;
        this.debounceMs = debounceMs;
        this.options = options;
        this.listener = listener;
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "render-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void submit(AdjustmentParameters params) {
        latest = params;
        if (inFlight != null)
            inFlight.cancel();
        if (pending != null)
            pending.cancel(false);
        pending = exec.schedule(this::renderLatest, debounceMs, TimeUnit.MILLISECONDS);
    }

    /** Render the pending snapshot now and wait for it. */
    public void flush() throws InterruptedException {
        synchronized (this) {
            if (pending != null)
                pending.cancel(false);
            pending = null;
        }
        Future<?> f = exec.submit(this::renderLatest);
        try {
            f.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Render failed during flush", e.getCause());
        }
    }

    public int rendersStarted() {
        return rendersStarted.get();
    }

    private void renderLatest() {
        AdjustmentParameters params;
        CancellationToken token = new CancellationToken();
        synchronized (this) {
            params = latest;
            latest = null;
            if (params == null)
                return;
            inFlight = token;
        }
        rendersStarted.incrementAndGet();
        RenderResult result = orchestrator.render(params, options.get(), token);
        synchronized (this) {
            if (inFlight == token)
                inFlight = null;
        }
        if (result.status() == RenderResult.Status.CANCELLED) {
            log.debug("Superseded render dropped");
            return;
        }
        try {
            listener.accept(result);
        } catch (RuntimeException e) {
            log.warn("Render listener failed: {}", e.toString());
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (inFlight != null)
                inFlight.cancel();
            if (pending != null)
                pending.cancel(false);
        }
        exec.shutdown();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS))
                exec.shutdownNow();
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
