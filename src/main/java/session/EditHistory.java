package session;

import params.AdjustmentParameters;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/** Bounded undo/redo stacks of parameter snapshots. */
final class EditHistory {

    private final int limit;
    private final Deque<AdjustmentParameters> undo = new ArrayDeque<>();
    private final Deque<AdjustmentParameters> redo = new ArrayDeque<>();

    EditHistory(int limit) {
        this.limit = limit;
    }

    /** Remember {@code previous} before moving to a new snapshot; clears redo. */
    void record(AdjustmentParameters previous) {
        undo.push(previous);
        while (undo.size() > limit)
            undo.removeLast();
        redo.clear();
    }

    Optional<AdjustmentParameters> undo(AdjustmentParameters current) {
        if (undo.isEmpty())
            return Optional.empty();
        redo.push(current);
        return Optional.of(undo.pop());
    }

    Optional<AdjustmentParameters> redo(AdjustmentParameters current) {
        if (redo.isEmpty())
            return Optional.empty();
        undo.push(current);
        return Optional.of(redo.pop());
    }

    boolean canUndo() {
        return !undo.isEmpty();
    }

    boolean canRedo() {
        return !redo.isEmpty();
    }

    void clear() {
        undo.clear();
        redo.clear();
    }
}
