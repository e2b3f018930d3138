package session;

import org.junit.Test;
import params.AdjustmentParameters;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EditHistoryTest {

    private static AdjustmentParameters ev(float v) {
        return AdjustmentParameters.builder().globalExposure(v).build();
    }

    @Test
    public void boundedHistoryDropsOldest() {
        EditHistory h = new EditHistory(2);
        h.record(ev(1));
        h.record(ev(2));
        h.record(ev(3));
        assertEquals(ev(3), h.undo(ev(4)).orElseThrow());
        assertEquals(ev(2), h.undo(ev(3)).orElseThrow());
        assertFalse(h.canUndo());
        assertTrue(h.canRedo());
        assertEquals(ev(3), h.redo(ev(2)).orElseThrow());
    }
}
