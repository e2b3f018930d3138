package stages;

import image.LinearImage;
import image.TestImages;
import org.junit.Test;
import params.AdjustmentParameters;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ToneBaseProcessorTest {

    private final ToneBaseProcessor tone = new ToneBaseProcessor();

    @Test
    public void neutralParametersDoNotRun() {
        assertFalse(tone.shouldExecute(AdjustmentParameters.neutral()));
        assertFalse(tone.shouldExecute(AdjustmentParameters.builder().contrast(1.0005f).build()));
        assertTrue(tone.shouldExecute(AdjustmentParameters.builder().rotation(1f).build()));
    }

    @Test
    public void oneStopDoublesLinearValues() {
        LinearImage img = LinearImage.filled(4, 4, 0.2f, 0.1f, 0.05f);
        LinearImage out = tone.process(img, AdjustmentParameters.builder().globalExposure(1f).build());
        assertEquals(0.4f, out.r()[0], 1e-6f);
        assertEquals(0.1f, out.b()[0], 1e-6f);
        assertEquals(0.2f, img.r()[0], 0f);
    }

    @Test
    public void contrastPivotsAtMidGrey() {
        assertEquals(0.5f, ToneBaseProcessor.contrast(0.5f, 2f), 1e-6f);
        assertEquals(0.7f, ToneBaseProcessor.contrast(0.6f, 2f), 1e-6f);
        assertEquals(0f, ToneBaseProcessor.contrast(0.1f, 3f), 0f);
    }

    @Test
    public void shadowsLiftDarkPixelsMoreThanBrightOnes() {
        float dark = ToneBaseProcessor.regionScale(0.02f, 0f, 50f, 0f, 0f);
        float bright = ToneBaseProcessor.regionScale(0.8f, 0f, 50f, 0f, 0f);
        assertTrue(dark > 1f);
        assertEquals(1f, bright, 1e-4f);
        assertEquals(1f, ToneBaseProcessor.regionScale(0.3f, 0f, 0f, 0f, 0f), 0f);
    }

    @Test
    public void lstarConversionRoundTrips() {
        for (float y : new float[] { 0.001f, 0.01f, 0.18f, 0.9f })
            assertEquals(y, ToneBaseProcessor.lstarToY(ToneBaseProcessor.yToLstar(y)), 1e-4f);
    }

    @Test
    public void cropRunsBeforeExposure() {
        LinearImage img = TestImages.gradient(40, 20);
        AdjustmentParameters p = AdjustmentParameters.builder()
                .cropEnabled(true).cropLeft(0.25f).cropTop(0f).cropRight(0.75f).cropBottom(0.5f)
                .globalExposure(1f)
                .build();
        LinearImage out = tone.process(img, p);
        assertEquals(20, out.width());
        assertEquals(10, out.height());
        assertEquals(img.r()[10] * 2f, out.r()[0], 1e-6f);
    }

    @Test
    public void smallRotationKeepsCanvasSize() {
        LinearImage out = Geometry.rotate(TestImages.gradient(30, 20), 5f);
        assertEquals(30, out.width());
        assertEquals(20, out.height());
    }
}
