package util;

import image.LinearImage;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class BayerDemosaicTest {

    private static float[] mosaicOf(int w, int h, CfaPattern p, float r, float g, float b) {
        float[] m = new float[w * h];
        float[] byColor = { r, g, b };
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                m[y * w + x] = byColor[p.colorAt(x, y)];
        return m;
    }

    private static void assertUniform(LinearImage img, float r, float g, float b) {
        for (int i = 0; i < img.pixelCount(); i++) {
            assertEquals("r@" + i, r, img.r()[i], 1e-6f);
            assertEquals("g@" + i, g, img.g()[i], 1e-6f);
            assertEquals("b@" + i, b, img.b()[i], 1e-6f);
        }
    }

    @Test
    public void uniformColorIsReconstructedForEveryPattern() {
        for (CfaPattern p : CfaPattern.values()) {
            float[] m = mosaicOf(10, 8, p, 0.8f, 0.5f, 0.2f);
            assertUniform(BayerDemosaic.bilinear(m, 10, 8, p), 0.8f, 0.5f, 0.2f);
            assertUniform(BayerDemosaic.edgeAware(m, 10, 8, p, true), 0.8f, 0.5f, 0.2f);
        }
    }

    @Test
    public void ownSampleIsKept() {
        float[] m = new float[16];
        for (int i = 0; i < m.length; i++)
            m[i] = i / 16f;
        LinearImage out = BayerDemosaic.bilinear(m, 4, 4, CfaPattern.RGGB);
        assertEquals(m[0], out.r()[0], 0f);
        assertEquals(m[5], out.b()[5], 0f);
        assertEquals(m[1], out.g()[1], 0f);
    }

    @Test
    public void zipperReductionPullsTowardMedian() {
        LinearImage img = LinearImage.filled(3, 3, 0f, 0f, 0f);
        img.r()[4] = 1f;
        LinearImage out = BayerDemosaic.reduceZipper(img);
        assertEquals(0.7f, out.r()[4], 1e-6f);
        assertEquals(0f, out.r()[0], 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void mismatchedLengthIsRejected() {
        BayerDemosaic.bilinear(new float[5], 2, 2, CfaPattern.RGGB);
    }
}
