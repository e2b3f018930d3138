package image;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DitheringTest {

    @Test
    public void isDeterministic() {
        LinearImage img = TestImages.photoLike(37, 23, 7);
        assertArrayEquals(Dithering.floydSteinberg(img, 8, true), Dithering.floydSteinberg(img, 8, true));
    }

    @Test
    public void preservesAverageLevel() {
        // 0.3 is between two 4-bit codes; diffusion keeps the mean close to it
        LinearImage flat = LinearImage.filled(64, 64, 0.3f, 0.3f, 0.3f);
        int[] q = Dithering.floydSteinberg(flat, 4, false);
        double sum = 0;
        for (int i = 0; i < q.length; i++)
            sum += q[i] / 15.0;
        assertEquals(0.3, sum / q.length, 0.01);
    }

    @Test
    public void oneBitOutputIsBinary() {
        int[] q = Dithering.floydSteinberg(TestImages.gradient(16, 8), 1, false);
        for (int v : q)
            assertTrue(v == 0 || v == 1);
    }

    @Test
    public void singlePixelHasNoNeighboursToDiffuseInto() {
        int[] q = Dithering.floydSteinberg(LinearImage.filled(1, 1, 1f, 0f, 0.5f), 8, false);
        assertArrayEquals(new int[] { 255, 0, 128 }, q);
    }

    @Test
    public void ditherInPlaceLeavesInputUntouched() {
        LinearImage img = TestImages.gradient(8, 8);
        LinearImage before = img.copy();
        LinearImage out = Dithering.ditherInPlace(img, 2);
        assertEquals(0f, TestImages.maxAbsDiff(img, before), 0f);
        for (float v : out.r())
            assertEquals(0f, (v * 3f) - Math.round(v * 3f), 1e-5f);
    }
}
