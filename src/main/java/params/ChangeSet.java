package params;

import pipeline.ProcessingStage;

import java.util.List;
import java.util.Set;

/**
 * Result of diffing two parameter snapshots.
 *
 * @param startStage        earliest affected stage, null when nothing changed
 * @param stagesToRecompute contiguous suffix of the stage order from {@code startStage}
 */
public record ChangeSet(Set<ParameterName> changedFields,
        Set<ProcessingStage> affectedStages,
        ProcessingStage startStage,
        List<ProcessingStage> stagesToRecompute) {

    public ChangeSet {
        changedFields = Set.copyOf(changedFields);
        affectedStages = Set.copyOf(affectedStages);
        stagesToRecompute = List.copyOf(stagesToRecompute);
    }

    public static ChangeSet none() {
        return new ChangeSet(Set.of(), Set.of(), null, List.of());
    }

    public boolean isEmpty() {
        return startStage == null;
    }

    public boolean hasChanges() {
        return !isEmpty();
    }

    public String summary() {
        if (isEmpty())
            return "no changes";
        return changedFields.size() + " field(s) changed, start=" + startStage + ", recompute=" + stagesToRecompute;
    }
}
