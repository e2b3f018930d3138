package image;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ColorSpaceTest {

    @Test
    public void roundTripStaysWithinTolerance() {
        for (int i = 0; i <= 1000; i++) {
            float v = i / 1000f;
            assertEquals("v=" + v, v, ColorSpace.srgbToLinear(ColorSpace.linearToSrgb(v)), 1e-3f);
        }
    }

    @Test
    public void linearSegmentMeetsPowerSegment() {
        assertEquals(0.04045f, ColorSpace.linearToSrgb(0.0031308f), 1e-4f);
        assertEquals(0.0031308f, ColorSpace.srgbToLinear(0.04045f), 1e-5f);
    }

    @Test
    public void inputsAreClampedToUnitRange() {
        assertEquals(0f, ColorSpace.linearToSrgb(-0.5f), 0f);
        assertEquals(1f, ColorSpace.linearToSrgb(4f), 1e-6f);
        assertEquals(1f, ColorSpace.srgbToLinear(1.5f), 1e-6f);
    }

    @Test
    public void eightBitTableMatchesFormula() {
        assertEquals(ColorSpace.srgbToLinear(128 / 255f), ColorSpace.srgb8ToLinear(128), 0f);
        assertEquals(0f, ColorSpace.srgb8ToLinear(0), 0f);
        assertEquals(1f, ColorSpace.srgb8ToLinear(255), 1e-6f);
    }
}
