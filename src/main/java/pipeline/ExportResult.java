package pipeline;

import java.nio.file.Path;

/**
 * @param failedStage the stage that threw, for kernel failures
 */
public record ExportResult(boolean success, Path output, int width, int height, long elapsedMs,
                           ErrorKind errorKind, ProcessingStage failedStage, String message) {

    static ExportResult success(Path output, int width, int height, long elapsedMs) {
        return new ExportResult(true, output, width, height, elapsedMs, null, null, null);
    }

    static ExportResult failure(ErrorKind kind, ProcessingStage stage, String message, long elapsedMs) {
        return new ExportResult(false, null, 0, 0, elapsedMs, kind, stage, message);
    }

    @Override
    public String toString() {
        if (success)
            return "Exported " + output + " (" + width + "x" + height + ") in " + elapsedMs + " ms";
        return "Export failed [" + errorKind + (failedStage != null ? " at " + failedStage : "") + "]: " + message;
    }
}
