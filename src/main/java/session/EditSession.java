package session;

import io.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import params.AdjustmentParameters;
import params.ParameterCodec;
import pipeline.PipelineOrchestrator;
import pipeline.RenderResult;
import pipeline.RenderScheduler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Editing state for one image at a time: the current parameters, their undo history, and
 * the wiring to the renderer and the parameter store.
 */
public final class EditSession {

    private static final Logger log = LoggerFactory.getLogger(EditSession.class);

    public static final int HISTORY_LIMIT = 50;
    public static final int RECENT_LIMIT = 10;

    private final ImageSourceProvider sources;
    private final ParameterStore store;
    private final PipelineOrchestrator orchestrator;
    private final EditHistory history = new EditHistory(HISTORY_LIMIT);
    private final LinkedHashSet<String> recent = new LinkedHashSet<>();

    private String imageId;
    private AdjustmentParameters current = AdjustmentParameters.neutral();

    public EditSession(ImageSourceProvider sources, ParameterStore store, PipelineOrchestrator orchestrator) {
        this.sources = sources;
        this.store = store;
        this.orchestrator = orchestrator;
    }

    /**
     * Decode the image and restore its saved parameters. An image that fails to decode is
     * dropped from the recent list.
     */
    public synchronized void open(String id) throws DecodeException {
        Path path = sources.resolve(id).orElse(null);
        if (path == null) {
            recent.remove(id);
            throw new DecodeException(null, "Unknown image id: " + id);
        }
        try {
            orchestrator.loadSource(path);
        } catch (DecodeException e) {
            recent.remove(id);
            log.warn("Dropping {} from recent images: {}", id, e.getMessage());
            throw e;
        }
        imageId = id;
        current = loadParameters(id);
        history.clear();
        recent.remove(id);
        recent.add(id);
        while (recent.size() > RECENT_LIMIT)
            recent.remove(recent.iterator().next());
    }

    private AdjustmentParameters loadParameters(String id) {
        try {
            Optional<byte[]> blob = store.load(id);
            if (blob.isPresent())
                return ParameterCodec.decode(new String(blob.get(), StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Saved parameters for {} unreadable, starting from defaults: {}", id, e.getMessage());
        }
        return AdjustmentParameters.neutral();
    }

    /** Move to {@code params} and render synchronously. */
    public synchronized RenderResult apply(AdjustmentParameters params) {
        requireOpen();
        if (!params.equals(current))
            history.record(current);
        current = params;
        return orchestrator.render(params);
    }

    public synchronized Optional<RenderResult> undo() {
        requireOpen();
        Optional<AdjustmentParameters> prev = history.undo(current);
        prev.ifPresent(p -> current = p);
        return prev.map(orchestrator::render);
    }

    public synchronized Optional<RenderResult> redo() {
        requireOpen();
        Optional<AdjustmentParameters> next = history.redo(current);
        next.ifPresent(p -> current = p);
        return next.map(orchestrator::render);
    }

    public synchronized void save() throws IOException {
        requireOpen();
        store.save(imageId, ParameterCodec.encode(current).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Feed snapshots from {@code events} through the debounced scheduler, recording each in
     * the undo history.
     */
    public AutoCloseable listen(ParameterEventStream events, RenderScheduler scheduler) {
        return events.subscribe(p -> {
            synchronized (this) {
                if (!p.equals(current))
                    history.record(current);
                current = p;
            }
            scheduler.submit(p);
        });
    }

    public synchronized AdjustmentParameters current() {
        return current;
    }

    public synchronized Optional<String> imageId() {
        return Optional.ofNullable(imageId);
    }

    public synchronized boolean canUndo() {
        return history.canUndo();
    }

    public synchronized boolean canRedo() {
        return history.canRedo();
    }

    /** Most recently opened last. */
    public synchronized List<String> recentImages() {
        return new ArrayList<>(recent);
    }

    public PipelineOrchestrator orchestrator() {
        return orchestrator;
    }

    private void requireOpen() {
        if (imageId == null)
            throw new IllegalStateException("No image open");
    }
}
