package stages;

import image.LinearImage;
import image.TestImages;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class BilateralFastTest {

    @Test
    public void downsampleFactorFollowsSigma() {
        assertEquals(1, BilateralFast.downsampleFactor(2f));
        assertEquals(1, BilateralFast.downsampleFactor(4f));
        assertEquals(2, BilateralFast.downsampleFactor(5f));
        assertEquals(4, BilateralFast.downsampleFactor(10f));
        assertEquals(8, BilateralFast.downsampleFactor(20f));
        assertEquals(BilateralFast.MAX_FACTOR, BilateralFast.downsampleFactor(100f));
    }

    @Test
    public void smallSigmaIsExact() {
        LinearImage img = TestImages.photoLike(24, 18, 3);
        LinearImage fast = new BilateralFast().apply(img, 2f, 0.1f);
        assertEquals(0f, TestImages.maxAbsDiff(BilateralStandard.filter(img, 2f, 0.1f), fast), 0f);
    }

    @Test
    public void keepsInputSizeAndFlatFields() {
        LinearImage flat = LinearImage.filled(37, 21, 0.3f, 0.6f, 0.9f);
        LinearImage out = new BilateralFast().apply(flat, 10f, 0.2f);
        assertEquals(37, out.width());
        assertEquals(21, out.height());
        assertEquals(0f, TestImages.maxAbsDiff(flat, out), 1e-4f);
    }
}
