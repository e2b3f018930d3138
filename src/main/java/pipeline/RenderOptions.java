package pipeline;

/**
 * Per-request output options.
 *
 * @param forceFull ignore the previous render and run every stage
 */
public record RenderOptions(boolean dither, boolean softClip, boolean forceFull) {

    public static RenderOptions from(PipelineConfig config) {
        return new RenderOptions(config.dither(), config.softClip(), false);
    }

    public RenderOptions withDither(boolean dither) {
        return new RenderOptions(dither, softClip, forceFull);
    }

    public RenderOptions withForceFull(boolean forceFull) {
        return new RenderOptions(dither, softClip, forceFull);
    }
}
