package pipeline;

import cache.SourceImage;
import hw.MemoryGuard;
import image.LinearImage;
import image.TestImages;
import io.SourceMetadata;
import io.SourceMetadata.SourceFormat;
import org.junit.Before;
import org.junit.Test;
import params.AdjustmentParameters;
import stages.BilateralConfig;
import stages.BilateralDispatcher;
import stages.StageProcessor;
import stages.StageProcessors;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static pipeline.ProcessingStage.DETAILS;
import static pipeline.ProcessingStage.EFFECTS;
import static pipeline.ProcessingStage.TONE_BASE;

public class PipelineOrchestratorTest {

    private static final AdjustmentParameters BASE = AdjustmentParameters.builder()
            .clarity(20f)
            .vignette(-15f)
            .build();

    private LinearImage photo;

    @Before
    public void setUp() {
        photo = TestImages.photoLike(96, 64, 42);
    }

    static PipelineOrchestrator newOrchestrator(PipelineConfig config, MemoryGuard guard) {
        return new PipelineOrchestrator(config,
                new StageProcessors(new BilateralDispatcher(BilateralConfig.defaults())), guard);
    }

    static PipelineOrchestrator newOrchestrator(PipelineConfig config) {
        return newOrchestrator(config, MemoryGuard.withSoftCap(Long.MAX_VALUE));
    }

    static SourceImage source(LinearImage img) {
        return SourceImage.of(img, new SourceMetadata(SourceFormat.RASTER, img.width(), img.height(), 8, null),
                null);
    }

    private PipelineOrchestrator loaded() {
        PipelineOrchestrator o = newOrchestrator(PipelineConfig.defaults());
        o.setSource(source(photo));
        return o;
    }

    @Test
    public void renderWithoutSourceFails() {
        PipelineOrchestrator o = newOrchestrator(PipelineConfig.defaults());
        RenderResult r = o.render(BASE);
        assertEquals(RenderResult.Status.FAILED, r.status());
        assertEquals(ErrorKind.NO_SOURCE, r.errorKind());
        assertEquals(RenderState.FAILED, o.state());
    }

    @Test
    public void firstRenderIsFull() {
        PipelineOrchestrator o = loaded();
        RenderResult r = o.render(BASE);
        assertEquals(RenderResult.Status.SUCCESS, r.status());
        assertTrue(r.plan().isFullProcessing());
        assertEquals(List.of(EFFECTS), r.executedStages());
        assertEquals(96, r.output().width());
        assertEquals(RenderState.DONE, o.state());
        assertEquals(2, o.cacheStats().l2Entries());
    }

    @Test
    public void sharpeningOnlyRunsDetailsFromCachedEffects() {
        PipelineOrchestrator o = loaded();
        o.render(BASE);
        RenderResult r = o.render(BASE.toBuilder().sharpening(40f).build());
        assertEquals(RenderResult.Status.SUCCESS, r.status());
        assertEquals(List.of(DETAILS), r.plannedStages());
        assertEquals(List.of(DETAILS), r.executedStages());
        assertTrue(r.cacheHits() >= 1);
        assertFalse(r.fromCache());
    }

    @Test
    public void exposureChangePlansEveryStage() {
        PipelineOrchestrator o = loaded();
        AdjustmentParameters plain = AdjustmentParameters.neutral();
        o.render(plain);
        RenderResult r = o.render(plain.toBuilder().globalExposure(0.5f).build());
        assertEquals(ProcessingStage.ordered(), r.plannedStages());
        assertEquals(List.of(TONE_BASE), r.executedStages());
    }

    @Test
    public void identicalRequestIsANoop() {
        PipelineOrchestrator o = loaded();
        RenderResult first = o.render(BASE);
        RenderResult second = o.render(BASE);
        assertEquals(RenderResult.Status.NOOP, second.status());
        assertTrue(second.isSuccess());
        assertSame(first.output(), second.output());
    }

    @Test
    public void incrementalOutputEqualsFreshFullRender() {
        AdjustmentParameters target = BASE.toBuilder().sharpening(35f).tint(8f).build();

        PipelineOrchestrator incremental = loaded();
        incremental.render(BASE);
        incremental.render(BASE.toBuilder().sharpening(35f).build());
        RenderResult viaCache = incremental.render(target);

        PipelineOrchestrator fresh = newOrchestrator(PipelineConfig.builder().cacheEnabled(false).build());
        fresh.setSource(source(photo));
        RenderResult full = fresh.render(target);

        assertEquals(full.output(), viaCache.output());
    }

    @Test
    public void undoToAPreviousSnapshotHitsThePreviewCache() {
        PipelineOrchestrator o = loaded();
        RenderResult a = o.render(BASE);
        o.render(BASE.toBuilder().grain(30f).build());
        RenderResult back = o.render(BASE);
        assertEquals(RenderResult.Status.SUCCESS, back.status());
        assertTrue(back.fromCache());
        assertTrue(back.executedStages().isEmpty());
        assertEquals(a.output(), back.output());
    }

    @Test
    public void failingStageKeepsLastGoodOutputAndIsNotCached() {
        PipelineOrchestrator o = loaded();
        StageProcessor effects = o.processors().get(EFFECTS);
        o.processors().register(new StageProcessor() {
            @Override
            public ProcessingStage stage() {
                return EFFECTS;
            }

            @Override
            public boolean shouldExecute(AdjustmentParameters params) {
                return effects.shouldExecute(params);
            }

            @Override
            public LinearImage process(LinearImage input, AdjustmentParameters params) {
                if (params.clarity() > 50f)
                    throw new IllegalStateException("kernel blew up");
                return effects.process(input, params);
            }
        });

        RenderResult good = o.render(BASE);
        int entries = o.cacheStats().l2Entries();
        AdjustmentParameters bad = BASE.toBuilder().clarity(80f).build();
        RenderResult failed = o.render(bad);

        assertEquals(RenderResult.Status.FAILED, failed.status());
        assertEquals(ErrorKind.KERNEL, failed.errorKind());
        assertSame(good.output(), failed.output());
        assertSame(good.output(), failed.lastGoodOutput());
        assertEquals(RenderState.FAILED, o.state());
        assertEquals(entries, o.cacheStats().l2Entries());

        RenderResult again = o.retry();
        assertEquals(RenderResult.Status.FAILED, again.status());

        o.processors().register(effects);
        assertEquals(RenderResult.Status.SUCCESS, o.retry().status());
    }

    @Test(expected = IllegalStateException.class)
    public void retryBeforeAnyRequestIsRejected() {
        loaded().retry();
    }

    @Test
    public void cancelledRenderNeverWritesCaches() {
        PipelineOrchestrator o = loaded();
        CancellationToken token = new CancellationToken();
        StageProcessor effects = o.processors().get(EFFECTS);
        AtomicReference<Boolean> ran = new AtomicReference<>(false);
        o.processors().register(new StageProcessor() {
            @Override
            public ProcessingStage stage() {
                return EFFECTS;
            }

            @Override
            public boolean shouldExecute(AdjustmentParameters params) {
                return effects.shouldExecute(params);
            }

            @Override
            public LinearImage process(LinearImage input, AdjustmentParameters params) {
                ran.set(true);
                token.cancel();
                return effects.process(input, params);
            }
        });

        RenderResult r = o.render(BASE, RenderOptions.from(o.config()), token);
        assertTrue(ran.get());
        assertEquals(RenderResult.Status.CANCELLED, r.status());
        assertEquals(RenderState.CANCELLED, o.state());
        assertEquals(0, o.cacheStats().l2Entries());
        assertEquals(0, o.cacheStats().l1Entries());
        assertFalse(o.lastOutput().isPresent());
    }

    @Test
    public void memoryPressureStepsDownTheLadder() {
        LinearImage big = TestImages.photoLike(200, 100, 3);
        long limit = LinearImage.estimateBytes(100, 50);
        MemoryGuard guard = new MemoryGuard(0.5, 0) {
            @Override
            public boolean underPressure(long bytesNeeded) {
                return bytesNeeded > limit;
            }
        };
        PipelineConfig config = PipelineConfig.builder().previewLadder(List.of(160, 80, 40)).build();
        PipelineOrchestrator o = newOrchestrator(config, guard);
        o.setSource(source(big));

        RenderResult r = o.render(BASE);
        assertEquals(RenderResult.Status.SUCCESS, r.status());
        assertEquals(80, o.previewEdge());
        assertEquals(80, r.output().width());
        assertEquals(40, r.output().height());
    }

    @Test
    public void backgroundRenderIsVisibleToOtherThreads() throws Exception {
        LinearImage big = TestImages.photoLike(200, 100, 3);
        long limit = LinearImage.estimateBytes(100, 50);
        MemoryGuard guard = new MemoryGuard(0.5, 0) {
            @Override
            public boolean underPressure(long bytesNeeded) {
                return bytesNeeded > limit;
            }
        };
        PipelineConfig config = PipelineConfig.builder().previewLadder(List.of(160, 80, 40)).build();
        PipelineOrchestrator o = newOrchestrator(config, guard);
        o.setSource(source(big));

        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            RenderResult r = worker.submit(() -> o.render(BASE)).get(30, TimeUnit.SECONDS);
            assertEquals(RenderResult.Status.SUCCESS, r.status());
        } finally {
            worker.shutdown();
        }
        assertEquals(80, o.previewEdge());
        assertEquals(80, o.lastOutput().orElseThrow().width());
    }

    @Test
    public void exhaustedLadderReportsOutOfMemory() {
        PipelineConfig config = PipelineConfig.builder().previewLadder(List.of(64, 32)).build();
        PipelineOrchestrator o = newOrchestrator(config, MemoryGuard.withSoftCap(1));
        o.setSource(source(photo));
        RenderResult r = o.render(BASE);
        assertEquals(RenderResult.Status.FAILED, r.status());
        assertEquals(ErrorKind.OUT_OF_MEMORY, r.errorKind());
        assertEquals(32, o.previewEdge());
    }

    @Test
    public void invalidateFromStageForcesRerun() {
        PipelineOrchestrator o = loaded();
        o.render(BASE);
        o.invalidateFromStage(EFFECTS);
        RenderResult r = o.render(BASE);
        assertEquals(RenderResult.Status.SUCCESS, r.status());
        assertEquals(EFFECTS, r.plan().startStage());
        assertTrue(r.executedStages().contains(EFFECTS));
    }

    @Test
    public void newSourceClearsDerivedCaches() {
        PipelineOrchestrator o = loaded();
        o.render(BASE);
        assertTrue(o.cacheStats().l2Entries() > 0);
        o.setSource(source(TestImages.photoLike(50, 40, 9)));
        assertEquals(0, o.cacheStats().l2Entries());
        assertEquals(0, o.cacheStats().l1Entries());
        RenderResult r = o.render(BASE);
        assertTrue(r.plan().isFullProcessing());
        assertEquals(50, r.output().width());
    }

    @Test
    public void disablingCacheStillRendersIncrementally() {
        PipelineOrchestrator o = loaded();
        o.setCacheEnabled(false);
        o.render(BASE);
        RenderResult r = o.render(BASE.toBuilder().sharpening(20f).build());
        assertEquals(RenderResult.Status.SUCCESS, r.status());
        assertEquals(0, o.cacheStats().l2Entries());
        assertTrue(r.executedStages().contains(EFFECTS));
        assertTrue(r.executedStages().contains(DETAILS));
    }

    @Test
    public void performanceMonitorCountsExecutions() {
        PipelineOrchestrator o = loaded();
        o.render(BASE);
        o.render(BASE.toBuilder().sharpening(10f).build());
        assertEquals(2, o.performanceMonitor().totalRenders());
        assertEquals(1, o.performanceMonitor().metrics(DETAILS).executions());
        assertNotNull(o.performanceMonitor().summary());
    }

    @Test
    public void estimateCoversOnlyTheSuffix() {
        PipelineOrchestrator o = loaded();
        assertEquals(71, o.estimateProcessingTime(null, BASE));
        assertEquals(30, o.estimateProcessingTime(BASE, BASE.toBuilder().sharpening(5f).build()));
    }
}
