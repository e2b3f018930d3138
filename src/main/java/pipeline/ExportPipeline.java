package pipeline;

import hw.BatteryMonitor;
import image.LinearImage;
import image.OutputConverter;
import image.Rgba8Buffer;
import io.DecodeException;
import io.ImageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import params.AdjustmentParameters;
import stages.BilateralDispatcher;
import stages.KernelException;
import stages.StageProcessors;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Full-resolution render to a file. Runs every stage on the decoded source with no preview
 * downscale and no session caches.
 */
public final class ExportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    private final StageProcessors processors;

    public ExportPipeline(PipelineConfig config) {
        this(new StageProcessors(new BilateralDispatcher(config.bilateral()
                .withCache(false)
                .withGpu(BatteryMonitor.gpuAllowed(config.bilateral().enableGpu())))));
    }

    public ExportPipeline(StageProcessors processors) {
        this.processors = processors;
    }

    public ExportResult export(Path source, AdjustmentParameters params, ExportOptions options) {
        long t0 = System.nanoTime();
        LinearImage image;
        try {
            image = ImageLoader.decodeSource(source).image();
        } catch (DecodeException e) {
            log.error("Export aborted, cannot decode {}: {}", source, e.getMessage());
            return ExportResult.failure(ErrorKind.DECODE, null, e.getMessage(), elapsedMs(t0));
        }
        return export(image, params, options, t0);
    }

    /** Export an already decoded full-resolution image. */
    public ExportResult export(LinearImage image, AdjustmentParameters params, ExportOptions options) {
        return export(image, params, options, System.nanoTime());
    }

    private ExportResult export(LinearImage image, AdjustmentParameters params, ExportOptions options, long t0) {
        ProcessingStage current = null;
        try {
            for (ProcessingStage stage : ProcessingStage.values()) {
                current = stage;
                image = processors.apply(stage, image, params);
            }
            current = null;
            Rgba8Buffer out = OutputConverter.linearToOutput(image, options.dither(), options.softClip());
            write(out, options);
        } catch (KernelException | IllegalArgumentException e) {
            log.error("Export failed in {}: {}", current, e.getMessage(), e);
            return ExportResult.failure(ErrorKind.KERNEL, current, e.getMessage(), elapsedMs(t0));
        } catch (OutOfMemoryError e) {
            log.error("Export ran out of memory in {} ({}x{})", current, image.width(), image.height());
            return ExportResult.failure(ErrorKind.OUT_OF_MEMORY, current,
                    "Out of memory at " + image.width() + "x" + image.height(), elapsedMs(t0));
        } catch (IOException e) {
            log.error("Could not write {}: {}", options.output(), e.getMessage());
            return ExportResult.failure(ErrorKind.IO, null, e.getMessage(), elapsedMs(t0));
        }
        long ms = elapsedMs(t0);
        log.info("Exported {} ({}x{}, {}) in {} ms", options.output(), image.width(), image.height(),
                options.format(), ms);
        return ExportResult.success(options.output(), image.width(), image.height(), ms);
    }

    static void write(Rgba8Buffer buf, ExportOptions options) throws IOException {
        Path out = options.output();
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        BufferedImage argb = buf.toBufferedImage();
        if (options.format() == ExportOptions.Format.PNG) {
            if (!ImageIO.write(argb, "png", out.toFile()))
                throw new IOException("No PNG writer available");
            return;
        }
        // JPEG has no alpha channel
        BufferedImage rgb = new BufferedImage(argb.getWidth(), argb.getHeight(), BufferedImage.TYPE_INT_RGB);
        rgb.getGraphics().drawImage(argb, 0, 0, null);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext())
            throw new IOException("No JPEG writer available");
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out.toFile())) {
            writer.setOutput(ios);
            ImageWriteParam p = writer.getDefaultWriteParam();
            p.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            p.setCompressionQuality(options.jpegQuality());
            writer.write(null, new IIOImage(rgb, null, null), p);
        } finally {
            writer.dispose();
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
