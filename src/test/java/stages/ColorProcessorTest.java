package stages;

import image.LinearImage;
import org.junit.Test;
import params.AdjustmentParameters;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ColorProcessorTest {

    private final ColorProcessor color = new ColorProcessor();

    @Test
    public void neutralParametersDoNotRun() {
        assertFalse(color.shouldExecute(AdjustmentParameters.neutral()));
        // grading offsets without blending do nothing
        assertFalse(color.shouldExecute(AdjustmentParameters.builder().gradingShadowsTemp(20f).gradingBlending(0f).build()));
        assertTrue(color.shouldExecute(AdjustmentParameters.builder().gradingShadowsTemp(20f).build()));
        assertTrue(color.shouldExecute(AdjustmentParameters.builder().vibrance(10f).build()));
    }

    @Test
    public void zeroSaturationGivesGrey() {
        LinearImage img = LinearImage.filled(2, 2, 0.8f, 0.3f, 0.1f);
        LinearImage out = color.process(img, AdjustmentParameters.builder().saturation(0f).build());
        assertEquals(out.r()[0], out.g()[0], 1e-6f);
        assertEquals(out.g()[0], out.b()[0], 1e-6f);
        assertEquals(img.luminance(0), out.g()[0], 1e-5f);
    }

    @Test
    public void neutralWhiteBalanceHasUnitGains() {
        float[] g = WhiteBalance.gains(0f, 0f);
        assertEquals(1f, g[0], 0f);
        assertEquals(1f, g[1], 0f);
        assertEquals(1f, g[2], 0f);
    }

    @Test
    public void temperatureDirectionsAreOpposite() {
        float[] warm = WhiteBalance.gains(-50f, 0f);
        float[] cool = WhiteBalance.gains(50f, 0f);
        assertTrue(warm[0] / warm[2] > 1f);
        assertTrue(cool[0] / cool[2] < 1f);
        assertEquals(10000f, WhiteBalance.targetTemperature(100f), 1f);
        assertEquals(2000f, WhiteBalance.targetTemperature(-100f), 1f);
    }

    @Test
    public void whiteBalancePreservesLuminance() {
        float[] px = { 0.4f, 0.3f, 0.2f };
        float before = ColorProcessor.luma(px);
        ColorProcessor.whiteBalance(px, WhiteBalance.gains(40f, -20f));
        assertEquals(before, ColorProcessor.luma(px), 1e-5f);
    }

    @Test
    public void hslConversionRoundTrips() {
        float[] hsl = ColorProcessor.rgbToHsl(0.9f, 0.4f, 0.1f);
        float[] rgb = new float[3];
        ColorProcessor.hslToRgb(hsl[0], hsl[1], hsl[2], rgb);
        assertEquals(0.9f, rgb[0], 1e-5f);
        assertEquals(0.4f, rgb[1], 1e-5f);
        assertEquals(0.1f, rgb[2], 1e-5f);
    }

    @Test
    public void hslLuminanceShiftIsAdditiveWithinItsBand() {
        float[] px = { 0.6f, 0.2f, 0.2f };
        float[] zero = new float[8];
        float[] lum = new float[8];
        lum[0] = 10f;
        float before = ColorProcessor.rgbToHsl(px[0], px[1], px[2])[2];
        ColorProcessor.hsl(px, zero, zero, lum);
        assertEquals(before + 0.1f, ColorProcessor.rgbToHsl(px[0], px[1], px[2])[2], 1e-5f);
    }
}
