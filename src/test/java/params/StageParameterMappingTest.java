package params;

import org.junit.Test;
import pipeline.ProcessingStage;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class StageParameterMappingTest {

    @Test
    public void everyParameterBelongsToExactlyOneStage() {
        StageParameterMapping.validate();
        Set<ParameterName> seen = EnumSet.noneOf(ParameterName.class);
        for (ProcessingStage s : ProcessingStage.values()) {
            for (ParameterName n : StageParameterMapping.parametersFor(s)) {
                assertTrue("duplicate " + n, seen.add(n));
                assertEquals(s, StageParameterMapping.stageOf(n));
            }
        }
        assertEquals(EnumSet.allOf(ParameterName.class), seen);
    }

    @Test
    public void geometryLivesInToneBase() {
        assertEquals(ProcessingStage.TONE_BASE, StageParameterMapping.stageOf(ParameterName.ROTATION));
        assertEquals(ProcessingStage.TONE_BASE, StageParameterMapping.stageOf(ParameterName.CROP_LEFT));
    }

    @Test
    public void stagesFromIsAContiguousSuffix() {
        assertEquals(List.of(ProcessingStage.COLOR, ProcessingStage.EFFECTS, ProcessingStage.DETAILS),
                StageParameterMapping.stagesFrom(ProcessingStage.COLOR));
        assertTrue(StageParameterMapping.stagesFrom(null).isEmpty());
        assertNull(StageParameterMapping.earliestStage(List.of()));
    }
}
