package stages;

import image.LinearImage;
import image.TestImages;
import org.junit.Test;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class StageProcessorsTest {

    private final StageProcessors processors = new StageProcessors(new BilateralDispatcher(BilateralConfig.defaults()));

    @Test
    public void neutralStagePassesInputThrough() {
        LinearImage img = TestImages.gradient(8, 8);
        for (ProcessingStage s : ProcessingStage.values())
            assertSame(img, processors.apply(s, img, AdjustmentParameters.neutral()));
    }

    @Test
    public void everyStageHasAProcessor() {
        for (ProcessingStage s : ProcessingStage.values())
            assertEquals(s, processors.get(s).stage());
    }

    @Test
    public void unexpectedRuntimeFailureBecomesKernelException() {
        processors.register(new StageProcessor() {
            @Override
            public ProcessingStage stage() {
                return ProcessingStage.CURVES;
            }

            @Override
            public boolean shouldExecute(AdjustmentParameters p) {
                return true;
            }

            @Override
            public LinearImage process(LinearImage input, AdjustmentParameters p) {
                throw new NullPointerException("lut");
            }
        });
        try {
            processors.apply(ProcessingStage.CURVES, TestImages.gradient(4, 4), AdjustmentParameters.neutral());
        } catch (KernelException e) {
            assertEquals("CURVES", e.kernel());
            assertEquals(NullPointerException.class, e.getCause().getClass());
            return;
        }
        throw new AssertionError("expected KernelException");
    }
}
