package params;

import org.junit.Test;
import pipeline.ProcessingStage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ParameterHasherTest {

    @Test
    public void sameParametersGiveSameDigest() {
        AdjustmentParameters p = AdjustmentParameters.builder().clarity(12.5f).vignette(-20f).build();
        ParameterHash a = ParameterHasher.hash(ProcessingStage.EFFECTS, p);
        ParameterHash b = ParameterHasher.hash(ProcessingStage.EFFECTS, p.toBuilder().build());
        assertEquals(a, b);
        assertTrue(a.matches(b));
        assertEquals(64, a.digest().length());
    }

    @Test
    public void hexDigestIsLowercaseSha256() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ParameterHasher.sha256Hex("abc"));
    }

    @Test
    public void digestOnlyCoversTheStagesOwnFields() {
        AdjustmentParameters p = AdjustmentParameters.neutral();
        AdjustmentParameters q = p.toBuilder().sharpening(30f).build();
        assertEquals(ParameterHasher.hash(ProcessingStage.TONE_BASE, p), ParameterHasher.hash(ProcessingStage.TONE_BASE, q));
        assertNotEquals(ParameterHasher.hash(ProcessingStage.DETAILS, p).digest(),
                ParameterHasher.hash(ProcessingStage.DETAILS, q).digest());
    }

    @Test
    public void roundsToFourDecimalsAndFoldsNegativeZero() {
        assertEquals("0.0000", ParameterHasher.round4(-0f));
        assertEquals("0.0000", ParameterHasher.round4(-0.00001f));
        assertEquals("1.2346", ParameterHasher.round4(1.23456f));
        AdjustmentParameters p = AdjustmentParameters.builder().tint(-0f).build();
        assertEquals(ParameterHasher.hash(ProcessingStage.COLOR, AdjustmentParameters.neutral()),
                ParameterHasher.hash(ProcessingStage.COLOR, p));
    }

    @Test
    public void matchesRequiresSameCanonicalText() {
        ParameterHash h = ParameterHasher.hash(ProcessingStage.CURVES, AdjustmentParameters.neutral());
        assertFalse(h.matches(new ParameterHash(h.stage(), h.digest(), h.canonical() + "x")));
        assertFalse(h.matches(null));
    }

    @Test
    public void hashAllCoversEveryStage() {
        assertEquals(ProcessingStage.values().length,
                ParameterHasher.hashAll(AdjustmentParameters.neutral()).size());
    }
}
