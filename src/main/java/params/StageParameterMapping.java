package params;

import pipeline.ProcessingStage;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static field-to-stage table and the stage arithmetic built on it.
 */
public final class StageParameterMapping {

    private static final Map<ProcessingStage, Set<ParameterName>> BY_STAGE = new EnumMap<>(ProcessingStage.class);

    static {
        for (ProcessingStage s : ProcessingStage.values())
            BY_STAGE.put(s, EnumSet.noneOf(ParameterName.class));
        for (ParameterName n : ParameterName.values())
            BY_STAGE.get(n.stage()).add(n);
        for (ProcessingStage s : ProcessingStage.values())
            BY_STAGE.put(s, Collections.unmodifiableSet(BY_STAGE.get(s)));
    }

    private StageParameterMapping() {
    }

    public static Set<ParameterName> parametersFor(ProcessingStage stage) {
        return BY_STAGE.get(stage);
    }

    public static ProcessingStage stageOf(ParameterName name) {
        return name.stage();
    }

    public static Set<ProcessingStage> affectedStages(Collection<ParameterName> changed) {
        Set<ProcessingStage> out = EnumSet.noneOf(ProcessingStage.class);
        for (ParameterName n : changed)
            out.add(n.stage());
        return out;
    }

    /** Lowest-order stage in the set, or null when the set is empty. */
    public static ProcessingStage earliestStage(Collection<ProcessingStage> stages) {
        ProcessingStage best = null;
        for (ProcessingStage s : stages) {
            if (best == null || s.order() < best.order())
                best = s;
        }
        return best;
    }

    public static List<ProcessingStage> stagesFrom(ProcessingStage start) {
        return start == null ? List.of() : ProcessingStage.from(start);
    }

    /**
     * Checks the table is total: every parameter belongs to exactly one stage.
     *
     * @throws IllegalStateException if a parameter is unmapped or mapped twice
     */
    public static void validate() {
        Set<ParameterName> seen = EnumSet.noneOf(ParameterName.class);
        for (Set<ParameterName> names : BY_STAGE.values()) {
            for (ParameterName n : names) {
                if (!seen.add(n))
                    throw new IllegalStateException("parameter mapped to more than one stage: " + n);
            }
        }
        if (seen.size() != ParameterName.values().length) {
            Set<ParameterName> missing = EnumSet.complementOf(EnumSet.copyOf(seen));
            throw new IllegalStateException("parameters without a stage: " + missing);
        }
    }
}
