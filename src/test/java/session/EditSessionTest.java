package session;

import image.TestImages;
import io.DecodeException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import params.AdjustmentParameters;
import pipeline.PipelineConfig;
import pipeline.PipelineOrchestrator;
import pipeline.RenderOptions;
import pipeline.RenderResult;
import pipeline.RenderScheduler;
import stages.BilateralConfig;
import stages.BilateralDispatcher;
import stages.StageProcessors;
import hw.MemoryGuard;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EditSessionTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private InMemoryImageSourceProvider sources;
    private InMemoryParameterStore store;
    private File photo;

    private final AdjustmentParameters a = AdjustmentParameters.builder().globalExposure(0.4f).build();
    private final AdjustmentParameters b = a.toBuilder().vignette(-20f).build();

    @Before
    public void setUp() throws Exception {
        photo = tmp.newFile("photo.png");
        TestImages.writePng(TestImages.photoLike(48, 32, 8), photo);
        sources = new InMemoryImageSourceProvider().register("photo", photo.toPath());
        store = new InMemoryParameterStore();
    }

    private EditSession newSession() {
        PipelineOrchestrator o = new PipelineOrchestrator(PipelineConfig.defaults(),
                new StageProcessors(new BilateralDispatcher(BilateralConfig.defaults())),
                MemoryGuard.withSoftCap(Long.MAX_VALUE));
        return new EditSession(sources, store, o);
    }

    @Test
    public void undoRedoWalkTheHistory() throws Exception {
        EditSession s = newSession();
        s.open("photo");
        assertFalse(s.canUndo());
        s.apply(a);
        s.apply(b);

        RenderResult back = s.undo().orElseThrow();
        assertEquals(a, s.current());
        assertTrue(back.fromCache());
        assertTrue(s.canRedo());

        s.redo().orElseThrow();
        assertEquals(b, s.current());
        assertFalse(s.redo().isPresent());
    }

    @Test
    public void newEditClearsRedo() throws Exception {
        EditSession s = newSession();
        s.open("photo");
        s.apply(a);
        s.apply(b);
        s.undo();
        s.apply(a.toBuilder().grain(10f).build());
        assertFalse(s.canRedo());
    }

    @Test
    public void savedParametersComeBackOnOpen() throws Exception {
        EditSession s = newSession();
        s.open("photo");
        s.apply(b);
        s.save();
        assertEquals(1, store.size());

        EditSession again = newSession();
        again.open("photo");
        assertEquals(b, again.current());
    }

    @Test
    public void unreadableSavedParametersFallBackToNeutral() throws Exception {
        store.save("photo", "sparkle=11\n".getBytes(StandardCharsets.UTF_8));
        EditSession s = newSession();
        s.open("photo");
        assertEquals(AdjustmentParameters.neutral(), s.current());
    }

    @Test
    public void failedOpenDropsImageFromRecent() throws Exception {
        EditSession s = newSession();
        s.open("photo");
        assertEquals(List.of("photo"), s.recentImages());

        Files.write(photo.toPath(), new byte[] { 0, 1, 2 });
        try {
            s.open("photo");
            fail("expected DecodeException");
        } catch (DecodeException expected) {
            assertTrue(s.recentImages().isEmpty());
        }
    }

    @Test
    public void corruptMosaicHeaderIsADecodeFailure() throws Exception {
        File bad = tmp.newFile("bad.pgm");
        Files.write(bad.toPath(), "P5\n50000 50000\n255\n".getBytes(StandardCharsets.US_ASCII));
        sources.register("bad", bad.toPath());
        EditSession s = newSession();
        s.open("photo");
        try {
            s.open("bad");
            fail("expected DecodeException");
        } catch (DecodeException expected) {
            assertEquals(List.of("photo"), s.recentImages());
        }
    }

    @Test(expected = DecodeException.class)
    public void unknownIdIsADecodeFailure() throws Exception {
        newSession().open("missing");
    }

    @Test(expected = IllegalStateException.class)
    public void applyNeedsAnOpenImage() {
        newSession().apply(a);
    }

    @Test
    public void sidecarStoreWritesNextToTheImage() throws Exception {
        SidecarParameterStore sidecar = new SidecarParameterStore(sources);
        sidecar.save("photo", "sharpening=12.0\n".getBytes(StandardCharsets.UTF_8));
        assertTrue(new File(photo.getPath() + SidecarParameterStore.SUFFIX).isFile());
        assertEquals("sharpening=12.0\n", new String(sidecar.load("photo").orElseThrow(), StandardCharsets.UTF_8));
        assertFalse(sidecar.load("other").isPresent());
    }

    @Test
    public void streamedSnapshotsRenderThroughTheScheduler() throws Exception {
        EditSession s = newSession();
        s.open("photo");
        List<RenderResult> delivered = new CopyOnWriteArrayList<>();
        InMemoryParameterEventStream events = new InMemoryParameterEventStream();
        try (RenderScheduler scheduler = new RenderScheduler(s.orchestrator(), 60_000,
                () -> RenderOptions.from(s.orchestrator().config()), delivered::add)) {
            AutoCloseable sub = s.listen(events, scheduler);
            events.publish(a);
            events.publish(b);
            assertEquals(b, s.current());
            assertTrue(s.canUndo());
            scheduler.flush();
            assertEquals(1, delivered.size());
            sub.close();
            assertEquals(0, events.subscribers());
        }
    }
}
