package stages;

import org.junit.Test;
import params.AdjustmentParameters;
import params.CurvePoint;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ToneCurveTest {

    private static final List<CurvePoint> LIFT = List.of(CurvePoint.of(0f, 0f), CurvePoint.of(0.5f, 0.7f),
            CurvePoint.of(1f, 1f));

    @Test
    public void identityOrDisabledCurveIsSkipped() {
        assertFalse(ToneCurve.of(true, AdjustmentParameters.IDENTITY_CURVE).isPresent());
        assertFalse(ToneCurve.of(false, LIFT).isPresent());
    }

    @Test
    public void passesThroughControlPoints() {
        ToneCurve c = ToneCurve.of(true, LIFT).orElseThrow();
        assertEquals(0f, c.apply(0f), 1e-6f);
        assertEquals(0.7f, c.apply(0.5f), 0.01f);
        assertEquals(1f, c.apply(1f), 1e-6f);
    }

    @Test
    public void unsortedPointsAreSortedAndOutputClamped() {
        ToneCurve c = ToneCurve.of(true, List.of(CurvePoint.of(1f, 1f), CurvePoint.of(0f, 0.2f))).orElseThrow();
        assertEquals(0.2f, c.apply(-3f), 1e-6f);
        assertEquals(1f, c.apply(7f), 1e-6f);
        float prev = -1f;
        for (float v : c.lut()) {
            assertTrue(v >= prev);
            prev = v;
        }
    }
}
