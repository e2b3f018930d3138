package stages;

import image.LinearImage;
import image.TestImages;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BilateralStandardTest {

    @Test
    public void constantImageIsAFixedPoint() {
        LinearImage flat = LinearImage.filled(20, 15, 0.4f, 0.2f, 0.7f);
        LinearImage out = BilateralStandard.filter(flat, 2f, 0.1f);
        assertEquals(0f, TestImages.maxAbsDiff(flat, out), 1e-5f);
    }

    @Test
    public void strongEdgeSurvivesSmallRangeSigma() {
        LinearImage step = LinearImage.blank(20, 10);
        for (int y = 0; y < 10; y++)
            for (int x = 10; x < 20; x++) {
                int i = y * 20 + x;
                step.r()[i] = step.g()[i] = step.b()[i] = 1f;
            }
        LinearImage out = BilateralStandard.filter(step, 3f, 0.05f);
        assertEquals(0f, out.g()[5 * 20 + 9], 1e-3f);
        assertEquals(1f, out.g()[5 * 20 + 10], 1e-3f);
    }

    @Test
    public void noiseIsReduced() {
        LinearImage noisy = TestImages.noise(32, 32, 11);
        LinearImage out = BilateralStandard.filter(noisy, 2f, 1f);
        assertTrue(variance(out.g()) < variance(noisy.g()) * 0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveSigmaIsRejected() {
        BilateralStandard.filter(TestImages.gradient(4, 4), 0f, 0.1f);
    }

    private static double variance(float[] v) {
        double mean = 0;
        for (float f : v)
            mean += f;
        mean /= v.length;
        double s = 0;
        for (float f : v)
            s += (f - mean) * (f - mean);
        return s / v.length;
    }
}
