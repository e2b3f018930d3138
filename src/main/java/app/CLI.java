package app;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import hw.BatteryMonitor;
import io.DecodeException;
import params.AdjustmentParameters;
import params.ParameterCodec;
import pipeline.ExportOptions;
import pipeline.ExportPipeline;
import pipeline.ExportResult;
import pipeline.PipelineConfig;
import pipeline.PipelineOrchestrator;
import pipeline.RenderResult;
import session.EditSession;
import session.InMemoryImageSourceProvider;
import session.SidecarParameterStore;

import javax.imageio.ImageIO;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line entry for the adjustment pipeline.
 * Example:
 * # preview with a few sliders
 * java -jar image-adjust-pipeline.jar --input photo.png --exposure 0.5 --clarity 20 -Pgrain=15
 *
 * # full-resolution export, GPU bilateral requested (also auto-disables on battery at or below 30%)
 * java -jar image-adjust-pipeline.jar --input photo.png --gpu --sharpening 40 --export out.jpg
 *
 * # interactive editing with incremental re-rendering
 * java -jar image-adjust-pipeline.jar --input photo.png --shell
 */
public final class CLI {

    // -------------------- Args --------------------
    private static final class Args {
        @Parameter(names = "--input", description = "Input image path (.jpg/.png/.arw/.pgm)", required = true)
        String input;

        @Parameter(names = "--exposure", description = "Exposure in EV [-5..5]")
        Float exposure;

        @Parameter(names = "--contrast", description = "Contrast multiplier (1 = neutral)")
        Float contrast;

        @Parameter(names = "--highlights", description = "Highlights [-100..100]")
        Float highlights;

        @Parameter(names = "--shadows", description = "Shadows [-100..100]")
        Float shadows;

        @Parameter(names = "--temperature", description = "Temperature [-100..100]")
        Float temperature;

        @Parameter(names = "--tint", description = "Tint [-100..100]")
        Float tint;

        @Parameter(names = "--saturation", description = "Saturation multiplier (1 = neutral)")
        Float saturation;

        @Parameter(names = "--vibrance", description = "Vibrance [-100..100]")
        Float vibrance;

        @Parameter(names = "--clarity", description = "Clarity [-100..100]")
        Float clarity;

        @Parameter(names = "--sharpening", description = "Sharpening [0..100]")
        Float sharpening;

        @Parameter(names = "--noise-reduction", description = "Noise reduction [0..100]")
        Float noiseReduction;

        @DynamicParameter(names = "-P", description = "Any other parameter, e.g. -Pvignette=-30 -Phsl_hue_shift=0,10,0,0,0,0,0,0")
        Map<String, String> extra = new HashMap<>();

        @Parameter(names = "--preview", description = "Preview PNG path (default: preview.png next to the input)")
        String preview;

        @Parameter(names = "--export", description = "Write a full-resolution PNG/JPEG to this path")
        String export;

        @Parameter(names = "--jpeg-quality", description = "JPEG export quality [0..1]")
        float jpegQuality = 0.92f;

        @Parameter(names = "--no-dither", description = "Disable Floyd-Steinberg dithering on export")
        boolean noDither = false;

        @Parameter(names = "--no-cache", description = "Disable the preview and stage caches")
        boolean noCache = false;

        @Parameter(names = "--gpu", description = "Use GPU bilateral filtering (OpenCL). Also honored via -Dbilateral.gpu.enabled=true")
        boolean gpu = false;

        @Parameter(names = "--shell", description = "Open the interactive edit shell after the first render")
        boolean shell = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    public static void main(String[] argv) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("image-adjust").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            System.err.println(pe.getMessage());
            jc.usage();
            System.exit(1);
        }
        if (args.help) {
            jc.usage();
            return;
        }

        PipelineConfig config = PipelineConfig.load();
        boolean userWantsGPU = args.gpu || config.bilateral().enableGpu();
        config = config.toBuilder()
                .cacheEnabled(config.cacheEnabled() && !args.noCache)
                .bilateral(config.bilateral().withGpu(userWantsGPU))
                .build();

        Path inPath = Paths.get(args.input);
        Path previewOut = args.preview != null ? Paths.get(args.preview)
                : inPath.toAbsolutePath().getParent() != null
                        ? inPath.toAbsolutePath().getParent().resolve("preview.png")
                        : Paths.get("preview.png");

        // Banner
        System.out.println("== Image Adjust Pipeline ==");
        System.out.println("Input: " + inPath);
        System.out.println("GPU requested: " + userWantsGPU + "  allowed: " + BatteryMonitor.gpuAllowed(userWantsGPU)
                + "  (AC=" + BatteryMonitor.onAC() + ", battery=" + BatteryMonitor.levelOrGuess() + "%)");

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(config);
        InMemoryImageSourceProvider sources = new InMemoryImageSourceProvider().register("input", inPath);
        EditSession session = new EditSession(sources, new SidecarParameterStore(sources), orchestrator);
        try {
            session.open("input");
        } catch (DecodeException e) {
            System.err.println("[decode] " + e.getMessage());
            System.exit(2);
            return;
        }

        AdjustmentParameters params;
        try {
            params = fromArgs(args, session.current());
        } catch (IllegalArgumentException e) {
            System.err.println("Bad parameter: " + e.getMessage());
            System.exit(1);
            return;
        }

        RenderResult result = session.apply(params);
        System.out.println(result);
        if (!result.isSuccess()) {
            System.err.println("Render failed: " + result.errorMessage());
            System.exit(3);
            return;
        }
        try {
            ImageIO.write(result.output().toBufferedImage(), "png", previewOut.toFile());
            System.out.println("Preview written to: " + previewOut + " (" + result.output().width() + "x"
                    + result.output().height() + ")");
        } catch (IOException e) {
            System.err.println("Failed to write preview: " + e.getMessage());
        }

        ExportPipeline exporter = new ExportPipeline(config);
        if (args.export != null) {
            ExportOptions opts = ExportOptions.forPath(Paths.get(args.export))
                    .withJpegQuality(args.jpegQuality)
                    .withDither(!args.noDither);
            ExportResult exported = exporter.export(inPath, session.current(), opts);
            System.out.println(exported);
            if (!exported.success())
                System.exit(4);
        }

        if (args.shell) {
            try {
                new EditShell(session, exporter, inPath, previewOut,
                        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out)
                        .run();
            } catch (IOException ioe) {
                System.err.println("Shell I/O error: " + ioe.getMessage());
            }
        }
    }

    static AdjustmentParameters fromArgs(Args a, AdjustmentParameters base) {
        AdjustmentParameters.Builder b = base.toBuilder();
        if (a.exposure != null) b.globalExposure(a.exposure);
        if (a.contrast != null) b.contrast(a.contrast);
        if (a.highlights != null) b.highlights(a.highlights);
        if (a.shadows != null) b.shadows(a.shadows);
        if (a.temperature != null) b.temperature(a.temperature);
        if (a.tint != null) b.tint(a.tint);
        if (a.saturation != null) b.saturation(a.saturation);
        if (a.vibrance != null) b.vibrance(a.vibrance);
        if (a.clarity != null) b.clarity(a.clarity);
        if (a.sharpening != null) b.sharpening(a.sharpening);
        if (a.noiseReduction != null) b.noiseReduction(a.noiseReduction);
        for (Map.Entry<String, String> e : a.extra.entrySet())
            ParameterCodec.set(b, ParameterCodec.parseName(EditShell.alias(e.getKey())), e.getValue());
        return b.build();
    }
}
