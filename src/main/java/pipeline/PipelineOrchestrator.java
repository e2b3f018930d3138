package pipeline;

import cache.CacheHierarchy;
import cache.CacheStats;
import cache.PreviewCache;
import cache.SourceImage;
import hw.BatteryMonitor;
import hw.MemoryGuard;
import image.LinearImage;
import image.OutputConverter;
import image.Rgba8Buffer;
import io.DecodeException;
import io.DecodedSource;
import io.ImageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import params.AdjustmentParameters;
import params.ParameterChangeDetector;
import params.ParameterHash;
import params.ParameterHasher;
import pipeline.StageExecutionResult.Outcome;
import stages.BilateralDispatcher;
import stages.KernelException;
import stages.StageProcessors;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Incremental preview renderer for one editing session.
 *
 * Each request is diffed against the last successful render; only the affected suffix of
 * the stage chain runs, seeded from the nearest valid stage-cache entry. Under memory
 * pressure the preview size steps down the configured ladder and the render restarts.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final PipelineConfig config;
    private final CacheHierarchy caches;
    private final StageProcessors processors;
    private final PerformanceMonitor monitor = new PerformanceMonitor();
    private final MemoryGuard memoryGuard;

    private final ReentrantLock renderLock = new ReentrantLock();
    private final AtomicLong requestSeq = new AtomicLong();

    private volatile RenderState state = RenderState.IDLE;
    private volatile boolean cacheEnabled;
    private volatile boolean incrementalEnabled;

    // written under renderLock, read lock-free by previewEdge() and lastOutput()
    private volatile int ladderIndex;
    private volatile Rgba8Buffer lastOutput;

    // guarded by renderLock
    private final List<Integer> ladder;
    private LinearImage preview;
    private String previewId;
    private AdjustmentParameters lastParams;
    private String lastPreviewId;
    private String lastIdentity;
    private ProcessingStage pendingInvalidation;
    private AdjustmentParameters lastRequested;
    private RenderOptions lastRequestedOptions;

    public PipelineOrchestrator(PipelineConfig config) {
        this(config, new StageProcessors(new BilateralDispatcher(config.bilateral()
                .withGpu(BatteryMonitor.gpuAllowed(config.bilateral().enableGpu())))), MemoryGuard.defaults());
    }

    public PipelineOrchestrator(PipelineConfig config, StageProcessors processors, MemoryGuard memoryGuard) {
        this.config = config;
        this.processors = processors;
        this.memoryGuard = memoryGuard;
        this.caches = new CacheHierarchy(config.l1MaxBytes(), config.l2MaxEntries(), config.verifyOnHit());
        this.cacheEnabled = config.cacheEnabled();
        this.incrementalEnabled = config.incrementalEnabled();
        this.ladder = config.previewLadder();
    }

    // ---- source ----

    /** Decode {@code path} and make it the session source. Clears every derived cache. */
    public SourceImage loadSource(Path path) throws DecodeException {
        DecodedSource decoded = ImageLoader.decodeSource(path);
        SourceImage src = SourceImage.of(decoded.image(), decoded.metadata(), path);
        setSource(src);
        log.info("Loaded source {} ({}x{}, id {})", path.getFileName(), decoded.image().width(),
                decoded.image().height(), src.id().substring(0, 12));
        return src;
    }

    public void setSource(SourceImage source) {
        renderLock.lock();
        try {
            caches.replaceSource(source);
            ladderIndex = 0;
            preview = null;
            previewId = null;
            lastParams = null;
            lastPreviewId = null;
            lastIdentity = null;
            pendingInvalidation = null;
        } finally {
            renderLock.unlock();
        }
    }

    public Optional<SourceImage> source() {
        return caches.source().get();
    }

    // ---- rendering ----

    public RenderResult render(AdjustmentParameters params) {
        return render(params, RenderOptions.from(config), CancellationToken.none());
    }

    public RenderResult render(AdjustmentParameters params, RenderOptions options, CancellationToken token) {
        long seq = requestSeq.incrementAndGet();
        renderLock.lock();
        try {
            RenderResult r = renderLocked(params, options, token, seq);
            monitor.recordRender(r.isSuccess());
            return r;
        } finally {
            renderLock.unlock();
        }
    }

    /** Re-run the last requested parameters, typically after a failure. */
    public RenderResult retry() {
        AdjustmentParameters params;
        RenderOptions options;
        renderLock.lock();
        try {
            params = lastRequested;
            options = lastRequestedOptions;
        } finally {
            renderLock.unlock();
        }
        if (params == null)
            throw new IllegalStateException("Nothing to retry: no render has been requested");
        return render(params, options, new CancellationToken());
    }

    private RenderResult renderLocked(AdjustmentParameters params, RenderOptions options, CancellationToken token,
                                      long seq) {
        lastRequested = params;
        lastRequestedOptions = options;
        long t0 = System.nanoTime();

        SourceImage src = caches.source().get().orElse(null);
        if (src == null) {
            state = RenderState.FAILED;
            log.error("Render requested with no source loaded");
            return RenderResult.failed(ErrorKind.NO_SOURCE, "No source image loaded", lastOutput, null,
                    List.of(), List.of(), 0, previewEdge());
        }

        boolean forceFull = options.forceFull();
        while (true) {
            try {
                return attempt(params, options, token, seq, src, forceFull, t0);
            } catch (MemoryPressure | OutOfMemoryError e) {
                if (!stepDownLadder()) {
                    state = RenderState.FAILED;
                    log.error("Out of memory at the smallest preview size ({}px)", previewEdge());
                    return RenderResult.failed(ErrorKind.OUT_OF_MEMORY,
                            "Out of memory at preview size " + previewEdge(), lastOutput, null, List.of(),
                            List.of(), elapsedMs(t0), previewEdge());
                }
                log.warn("Memory pressure ({}), preview size stepped down to {}px, restarting render",
                        e instanceof MemoryPressure ? "soft cap" : "OutOfMemoryError", previewEdge());
                caches.stages().evictOldest(caches.stages().size());
                caches.previews().clear();
                preview = null;
                forceFull = true;
            }
        }
    }

    private RenderResult attempt(AdjustmentParameters params, RenderOptions options, CancellationToken token,
                                 long seq, SourceImage src, boolean forceFull, long t0) {
        LinearImage base = previewFor(src);
        Map<ProcessingStage, ParameterHash> hashes = ParameterHasher.hashAll(params);
        Map<ProcessingStage, String> upstream = new EnumMap<>(ProcessingStage.class);
        String finalId = upstreamIds(previewId, hashes, upstream);
        String identity = PreviewCache.identity(options.softClip() ? finalId + "+sc" : finalId, options.dither());

        ProcessingPlan plan = buildPlan(params, forceFull);
        state = RenderState.PLAN_BUILT;
        log.debug("{}", plan);

        if (plan.isEmpty() && lastOutput != null && identity.equals(lastIdentity)) {
            state = RenderState.DONE;
            lastParams = params;
            return new RenderResult(RenderResult.Status.NOOP, lastOutput, plan, List.of(), List.of(),
                    ProcessingStage.ordered(), List.of(), 0, 0, elapsedMs(t0), true, previewEdge(), null, null);
        }

        if (cacheEnabled) {
            Optional<Rgba8Buffer> l1 = caches.previews().get(identity);
            if (l1.isPresent()) {
                commit(params, l1.get(), identity);
                log.debug("Preview cache hit for {}", identity.substring(0, 12));
                return new RenderResult(RenderResult.Status.SUCCESS, l1.get(), plan, plan.stagesToExecute(),
                        List.of(), ProcessingStage.ordered(), List.of(), 0, 0, elapsedMs(t0), true, previewEdge(),
                        null, null);
            }
        }

        state = RenderState.EXECUTING;
        List<StageExecutionResult> stageResults = new ArrayList<>();
        List<ProcessingStage> executed = new ArrayList<>();
        Set<ProcessingStage> missed = EnumSet.noneOf(ProcessingStage.class);
        long hits = 0, misses = 0;

        // seed from the nearest cached stage before the plan start, else the preview source
        LinearImage image = null;
        ProcessingStage seed = null;
        if (cacheEnabled) {
            ProcessingStage last = ProcessingStage.values()[ProcessingStage.values().length - 1];
            ProcessingStage s = plan.isEmpty() ? last : plan.startStage().previous();
            for (; s != null; s = s.previous()) {
                if (!s.shouldCache())
                    continue;
                Optional<LinearImage> hit = caches.stages().get(s, hashes.get(s), upstream.get(s));
                if (hit.isPresent()) {
                    hits++;
                    image = hit.get();
                    seed = s;
                    monitor.recordCacheHit(s);
                    stageResults.add(new StageExecutionResult(s, Outcome.CACHE_HIT, 0));
                    break;
                }
                missed.add(s);
                misses++;
            }
        }
        List<ProcessingStage> toRun;
        if (image == null) {
            image = base;
            toRun = ProcessingStage.ordered();
        } else {
            toRun = seed.next() == null ? List.of() : ProcessingStage.from(seed.next());
        }
        if (!plan.isEmpty() && !toRun.isEmpty() && toRun.get(0).order() < plan.startStage().order())
            log.debug("No cached seed before {}, starting at {}", plan.startStage(), toRun.get(0));

        for (ProcessingStage stage : toRun) {
            if (token.isCancelled()) {
                state = RenderState.CANCELLED;
                log.debug("Render cancelled before {}", stage);
                return new RenderResult(RenderResult.Status.CANCELLED, lastOutput, plan, plan.stagesToExecute(),
                        executed, skipped(executed), stageResults, hits, misses, elapsedMs(t0), false,
                        previewEdge(), null, null);
            }

            ParameterHash hash = hashes.get(stage);
            String up = upstream.get(stage);
            boolean cacheable = cacheEnabled && stage.shouldCache();
            if (cacheable && !missed.contains(stage)) {
                Optional<LinearImage> hit = caches.stages().get(stage, hash, up);
                if (hit.isPresent()) {
                    hits++;
                    image = hit.get();
                    monitor.recordCacheHit(stage);
                    stageResults.add(new StageExecutionResult(stage, Outcome.CACHE_HIT, 0));
                    continue;
                }
                misses++;
            }

            if (memoryGuard.underPressure(image.width(), image.height()))
                throw new MemoryPressure();

            boolean runs = processors.shouldExecute(stage, params);
            long s0 = System.nanoTime();
            LinearImage out;
            try {
                out = processors.apply(stage, image, params);
            } catch (KernelException | IllegalArgumentException e) {
                long micros = (System.nanoTime() - s0) / 1000;
                stageResults.add(new StageExecutionResult(stage, Outcome.FAILED, micros));
                state = RenderState.FAILED;
                log.error("Stage {} failed: {}", stage, e.getMessage(), e);
                return RenderResult.failed(ErrorKind.KERNEL, stage + ": " + e.getMessage(), lastOutput, plan,
                        executed, stageResults, elapsedMs(t0), previewEdge());
            }
            long micros = (System.nanoTime() - s0) / 1000;
            if (runs) {
                executed.add(stage);
                monitor.recordExecution(stage, micros);
                stageResults.add(new StageExecutionResult(stage, Outcome.EXECUTED, micros));
                log.debug("{} ran in {} ms", stage, micros / 1000.0);
            } else {
                stageResults.add(new StageExecutionResult(stage, Outcome.PASSTHROUGH, micros));
            }
            image = out;

            if (cacheable) {
                caches.stages().putIfCurrent(stage, hash, up, image,
                        () -> !token.isCancelled() && requestSeq.get() == seq);
            }
        }

        if (token.isCancelled()) {
            state = RenderState.CANCELLED;
            return new RenderResult(RenderResult.Status.CANCELLED, lastOutput, plan, plan.stagesToExecute(),
                    executed, skipped(executed), stageResults, hits, misses, elapsedMs(t0), false, previewEdge(),
                    null, null);
        }

        Rgba8Buffer output = OutputConverter.linearToOutput(image, options.dither(), options.softClip());
        if (cacheEnabled && requestSeq.get() == seq)
            caches.previews().put(identity, output);
        commit(params, output, identity);

        long elapsed = elapsedMs(t0);
        log.debug("Rendered in {} ms: executed {}, {} cache hits", elapsed, executed, hits);
        return new RenderResult(RenderResult.Status.SUCCESS, output, plan, plan.stagesToExecute(), executed,
                skipped(executed), stageResults, hits, misses, elapsed, executed.isEmpty(), previewEdge(), null,
                null);
    }

    private void commit(AdjustmentParameters params, Rgba8Buffer output, String identity) {
        lastParams = params;
        lastPreviewId = previewId;
        lastOutput = output;
        lastIdentity = identity;
        state = RenderState.DONE;
    }

    private ProcessingPlan buildPlan(AdjustmentParameters params, boolean forceFull) {
        ProcessingPlan plan;
        if (forceFull || lastParams == null || !incrementalEnabled || !previewId.equals(lastPreviewId))
            plan = ProcessingPlan.fullProcessing();
        else
            plan = ProcessingPlan.incrementalProcessing(
                    ParameterChangeDetector.detectChanges(lastParams, params).changedFields());

        if (pendingInvalidation != null) {
            ProcessingStage start = plan.startStage();
            if (start == null || pendingInvalidation.order() < start.order())
                plan = ProcessingPlan.fromStage(pendingInvalidation);
            pendingInvalidation = null;
        }
        return plan;
    }

    /**
     * Fills {@code out} with the upstream identity of every stage and returns the identity
     * of the final stage's output.
     */
    static String upstreamIds(String sourceId, Map<ProcessingStage, ParameterHash> hashes,
                              Map<ProcessingStage, String> out) {
        StringBuilder chain = new StringBuilder(sourceId);
        for (ProcessingStage s : ProcessingStage.values()) {
            out.put(s, s.previous() == null ? sourceId : ParameterHasher.sha256Hex(chain.toString()));
            chain.append('|').append(hashes.get(s).digest());
        }
        return ParameterHasher.sha256Hex(chain.toString());
    }

    private LinearImage previewFor(SourceImage src) {
        int edge = previewEdge();
        String id = src.previewId(edge);
        if (preview == null || !id.equals(previewId)) {
            preview = src.image().downscaleToFit(edge);
            previewId = id;
        }
        return preview;
    }

    private boolean stepDownLadder() {
        if (ladderIndex + 1 >= ladder.size())
            return false;
        ladderIndex = ladderIndex + 1;
        return true;
    }

    private static List<ProcessingStage> skipped(List<ProcessingStage> executed) {
        List<ProcessingStage> out = new ArrayList<>();
        for (ProcessingStage s : ProcessingStage.values()) {
            if (!executed.contains(s))
                out.add(s);
        }
        return out;
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    // ---- cache control ----

    /** Drop cached outputs from {@code stage} on and make the next render start there at the latest. */
    public void invalidateFromStage(ProcessingStage stage) {
        renderLock.lock();
        try {
            int removed = caches.stages().invalidateFrom(stage);
            caches.previews().clear();
            if (pendingInvalidation == null || stage.order() < pendingInvalidation.order())
                pendingInvalidation = stage;
            lastIdentity = null;
            log.debug("Invalidated from {} ({} stage entries dropped)", stage, removed);
        } finally {
            renderLock.unlock();
        }
    }

    public void setCacheEnabled(boolean enabled) {
        this.cacheEnabled = enabled;
        if (!enabled)
            clearCaches();
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setIncrementalEnabled(boolean enabled) {
        this.incrementalEnabled = enabled;
    }

    public boolean isIncrementalEnabled() {
        return incrementalEnabled;
    }

    /** Clear L2 and L1; the source stays loaded. */
    public void clearCaches() {
        renderLock.lock();
        try {
            caches.clearDerived();
            processors.bilateral().clearCache();
            lastIdentity = null;
        } finally {
            renderLock.unlock();
        }
    }

    public long estimateProcessingTime(AdjustmentParameters oldParams, AdjustmentParameters newParams) {
        if (oldParams == null)
            return ProcessingPlan.fullProcessing().estimatedTotalTimeMs();
        return ProcessingPlan.estimateProcessingTime(
                ParameterChangeDetector.detectChanges(oldParams, newParams).changedFields());
    }

    // ---- observation ----

    public RenderState state() {
        return state;
    }

    public CacheStats cacheStats() {
        return caches.stats();
    }

    public PerformanceMonitor performanceMonitor() {
        return monitor;
    }

    public int previewEdge() {
        return ladder.get(Math.min(ladderIndex, ladder.size() - 1));
    }

    public Optional<Rgba8Buffer> lastOutput() {
        return Optional.ofNullable(lastOutput);
    }

    public PipelineConfig config() {
        return config;
    }

    public StageProcessors processors() {
        return processors;
    }

    CacheHierarchy caches() {
        return caches;
    }

    /** Soft-cap signal from {@link MemoryGuard}; never escapes the orchestrator. */
    private static final class MemoryPressure extends RuntimeException {
        MemoryPressure() {
            super("memory soft cap reached", null, false, false);
        }
    }
}
