package app;

import image.Rgba8Buffer;
import params.AdjustmentParameters;
import params.ParameterCodec;
import params.ParameterName;
import pipeline.ExportOptions;
import pipeline.ExportPipeline;
import pipeline.ExportResult;
import pipeline.RenderResult;
import session.EditSession;

import javax.imageio.ImageIO;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Line-oriented editing shell over an open {@link EditSession}. Every change re-renders
 * incrementally and rewrites the preview file.
 */
public final class EditShell {

    private final EditSession session;
    private final ExportPipeline exporter;
    private final Path sourcePath;
    private final BufferedReader in;
    private final PrintStream out;
    private Path previewPath;

    public EditShell(EditSession session, ExportPipeline exporter, Path sourcePath, Path previewPath,
                     BufferedReader in, PrintStream out) {
        this.session = session;
        this.exporter = exporter;
        this.sourcePath = sourcePath;
        this.previewPath = previewPath;
        this.in = in;
        this.out = out;
    }

    public void run() throws IOException {
        out.println();
        out.println("Edit shell. Commands:");
        out.println("  set <param> <value>   e.g., set exposure 0.5 | set grain 20");
        out.println("  reset [param]");
        out.println("  undo | redo");
        out.println("  show");
        out.println("  stats");
        out.println("  preview <name.png>");
        out.println("  export <name.png|name.jpg>");
        out.println("  save                  store parameters next to the image");
        out.println("  quit");
        out.println();

        while (true) {
            out.print("edit> ");
            out.flush();
            String line = in.readLine();
            if (line == null)
                break;
            line = line.trim();
            if (line.isEmpty())
                continue;

            String[] parts = line.split("\\s+");
            String cmd = parts[0].toLowerCase();
            String[] args = parts.length > 1 ? Arrays.copyOfRange(parts, 1, parts.length) : new String[0];
            if (!execute(cmd, args))
                break;
        }
    }

    /** @return false when the shell should exit */
    boolean execute(String cmd, String[] args) {
        switch (cmd) {
            case "set" -> {
                if (args.length < 2) {
                    out.println("Usage: set <param> <value>");
                    return true;
                }
                try {
                    ParameterName name = ParameterCodec.parseName(alias(args[0]));
                    String value = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
                    AdjustmentParameters next = ParameterCodec.set(session.current().toBuilder(), name, value).build();
                    report(session.apply(next));
                } catch (IllegalArgumentException e) {
                    out.println("Rejected: " + e.getMessage());
                }
            }
            case "reset" -> {
                AdjustmentParameters next;
                if (args.length == 0) {
                    next = AdjustmentParameters.neutral();
                } else {
                    try {
                        ParameterName name = ParameterCodec.parseName(alias(args[0]));
                        String neutral = ParameterCodec.value(name, AdjustmentParameters.neutral());
                        next = ParameterCodec.set(session.current().toBuilder(), name, neutral).build();
                    } catch (IllegalArgumentException e) {
                        out.println("Rejected: " + e.getMessage());
                        return true;
                    }
                }
                report(session.apply(next));
            }
            case "undo" -> reportOptional(session.undo(), "Nothing to undo.");
            case "redo" -> reportOptional(session.redo(), "Nothing to redo.");
            case "show" -> out.print(ParameterCodec.encode(session.current()));
            case "stats" -> {
                out.println(session.orchestrator().cacheStats());
                out.print(session.orchestrator().performanceMonitor().summary());
                out.println("Bilateral: " + session.orchestrator().processors().bilateral().stats().snapshot());
                out.println("Preview edge: " + session.orchestrator().previewEdge() + "px");
            }
            case "preview" -> {
                if (args.length == 0) {
                    out.println("Usage: preview <name.png>");
                    return true;
                }
                previewPath = resolve(args[0]);
                writePreview();
            }
            case "export" -> {
                if (args.length == 0) {
                    out.println("Usage: export <name.png|name.jpg>");
                    return true;
                }
                ExportResult r = exporter.export(sourcePath, session.current(), ExportOptions.forPath(resolve(args[0])));
                out.println(r);
            }
            case "save" -> {
                try {
                    session.save();
                    out.println("Parameters saved.");
                } catch (IOException e) {
                    out.println("Save failed: " + e.getMessage());
                }
            }
            case "quit", "exit" -> {
                return false;
            }
            default -> out.println("Unknown command: " + cmd);
        }
        return true;
    }

    private void reportOptional(Optional<RenderResult> r, String emptyMessage) {
        if (r.isPresent())
            report(r.get());
        else
            out.println(emptyMessage);
    }

    private void report(RenderResult r) {
        out.println(r);
        if (r.status() == RenderResult.Status.FAILED)
            out.println("Keeping the last good preview. Fix the parameter and try again.");
        else
            writePreview();
    }

    private void writePreview() {
        Optional<Rgba8Buffer> last = session.orchestrator().lastOutput();
        if (last.isEmpty()) {
            out.println("No preview rendered yet.");
            return;
        }
        try {
            ImageIO.write(last.get().toBufferedImage(), "png", previewPath.toFile());
            out.println("Preview written to: " + previewPath);
        } catch (IOException e) {
            out.println("Failed to write preview: " + e.getMessage());
        }
    }

    private Path resolve(String name) {
        Path dir = sourcePath.toAbsolutePath().getParent();
        return dir != null ? dir.resolve(name) : Path.of(name);
    }

    /** Short names for the common sliders. */
    static String alias(String s) {
        return switch (s.toLowerCase()) {
            case "exposure", "ev" -> "global_exposure";
            case "nr", "noise" -> "noise_reduction";
            case "sharpen" -> "sharpening";
            default -> s;
        };
    }
}
