package pipeline;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/** Per-stage execution and cache counters. */
public final class PerformanceMonitor {

    private static final class StageCounters {
        final LongAdder executions = new LongAdder();
        final LongAdder cacheHits = new LongAdder();
        final LongAdder totalMicros = new LongAdder();
        final AtomicLong lastMicros = new AtomicLong();
    }

    public record StageMetrics(ProcessingStage stage, long executions, long cacheHits, double totalMs,
                               double lastMs) {
        public double averageMs() {
            return executions == 0 ? 0.0 : totalMs / executions;
        }
    }

    private final Map<ProcessingStage, StageCounters> counters = new EnumMap<>(ProcessingStage.class);
    private final LongAdder renders = new LongAdder();
    private final LongAdder failedRenders = new LongAdder();

    public PerformanceMonitor() {
        for (ProcessingStage s : ProcessingStage.values())
            counters.put(s, new StageCounters());
    }

    void recordExecution(ProcessingStage stage, long micros) {
        StageCounters c = counters.get(stage);
        c.executions.increment();
        c.totalMicros.add(micros);
        c.lastMicros.set(micros);
    }

    void recordCacheHit(ProcessingStage stage) {
        counters.get(stage).cacheHits.increment();
    }

    void recordRender(boolean success) {
        renders.increment();
        if (!success)
            failedRenders.increment();
    }

    public StageMetrics metrics(ProcessingStage stage) {
        StageCounters c = counters.get(stage);
        return new StageMetrics(stage, c.executions.sum(), c.cacheHits.sum(), c.totalMicros.sum() / 1000.0,
                c.lastMicros.get() / 1000.0);
    }

    public long totalRenders() {
        return renders.sum();
    }

    public long failedRenders() {
        return failedRenders.sum();
    }

    public void reset() {
        for (StageCounters c : counters.values()) {
            c.executions.reset();
            c.cacheHits.reset();
            c.totalMicros.reset();
            c.lastMicros.set(0);
        }
        renders.reset();
        failedRenders.reset();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "renders=%d failed=%d%n", totalRenders(), failedRenders()));
        for (ProcessingStage s : ProcessingStage.values()) {
            StageMetrics m = metrics(s);
            sb.append(String.format(Locale.ROOT, "  %-9s runs=%-5d hits=%-5d avg=%7.2f ms last=%7.2f ms%n",
                    s, m.executions(), m.cacheHits(), m.averageMs(), m.lastMs()));
        }
        return sb.toString();
    }
}
