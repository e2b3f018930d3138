package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;

/**
 * Kernel chain for one pipeline stage. Implementations return a new image and leave
 * the input untouched.
 */
public interface StageProcessor {

    ProcessingStage stage();

    /** False when every parameter this stage reads is at its neutral value. */
    boolean shouldExecute(AdjustmentParameters params);

    LinearImage process(LinearImage input, AdjustmentParameters params);
}
