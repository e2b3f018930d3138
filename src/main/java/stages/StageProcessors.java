package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Stage-to-processor registry and the single entry point the orchestrator uses to run a stage.
 */
public final class StageProcessors {

    private final Map<ProcessingStage, StageProcessor> processors = new EnumMap<>(ProcessingStage.class);
    private final BilateralDispatcher bilateral;

    public StageProcessors(BilateralDispatcher bilateral) {
        this.bilateral = bilateral;
        register(new ToneBaseProcessor());
        register(new CurvesProcessor());
        register(new ColorProcessor());
        register(new EffectsProcessor(bilateral));
        register(new DetailsProcessor(bilateral));
    }

    /** Replace the processor for its stage; used to plug in instrumented processors. */
    public void register(StageProcessor processor) {
        processors.put(processor.stage(), processor);
    }

    public StageProcessor get(ProcessingStage stage) {
        return processors.get(stage);
    }

    public BilateralDispatcher bilateral() {
        return bilateral;
    }

    public boolean shouldExecute(ProcessingStage stage, AdjustmentParameters params) {
        return processors.get(stage).shouldExecute(params);
    }

    /**
     * Run one stage. A stage whose parameters are all neutral returns its input unchanged.
     *
     * @throws KernelException if the stage fails; argument errors and VM errors pass through
     */
    public LinearImage apply(ProcessingStage stage, LinearImage image, AdjustmentParameters params) {
        StageProcessor p = processors.get(stage);
        if (!p.shouldExecute(params))
            return image;
        try {
            return p.process(image, params);
        } catch (KernelException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KernelException(stage.name(), e.toString(), e);
        }
    }
}
