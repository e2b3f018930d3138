package params;

import pipeline.ProcessingStage;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Diffs parameter snapshots into the set of stages that must re-run.
 *
 * Values are compared in the same rounded form the hasher digests, so a field reported
 * unchanged here can never produce a different cache key.
 */
public final class ParameterChangeDetector {

    private ParameterChangeDetector() {
    }

    public static ChangeSet detectChanges(AdjustmentParameters oldParams, AdjustmentParameters newParams) {
        Objects.requireNonNull(newParams, "newParams");
        if (oldParams == null) {
            return new ChangeSet(EnumSet.allOf(ParameterName.class), EnumSet.allOf(ProcessingStage.class),
                    ProcessingStage.TONE_BASE, ProcessingStage.ordered());
        }
        if (oldParams.equals(newParams))
            return ChangeSet.none();

        Set<ParameterName> changed = changedFields(oldParams, newParams);
        if (changed.isEmpty())
            return ChangeSet.none();

        Set<ProcessingStage> affected = StageParameterMapping.affectedStages(changed);
        ProcessingStage start = StageParameterMapping.earliestStage(affected);
        return new ChangeSet(changed, affected, start, ProcessingStage.from(start));
    }

    public static Set<ParameterName> changedFields(AdjustmentParameters a, AdjustmentParameters b) {
        Set<ParameterName> out = EnumSet.noneOf(ParameterName.class);
        for (ParameterName n : ParameterName.values()) {
            Object va = n.read(a);
            Object vb = n.read(b);
            if (va.equals(vb))
                continue;
            if (!ParameterHasher.canonical(va).equals(ParameterHasher.canonical(vb)))
                out.add(n);
        }
        return out;
    }
}
