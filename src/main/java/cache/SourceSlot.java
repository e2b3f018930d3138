package cache;

import java.util.Optional;

/** L3: the single decoded source of the session. */
public final class SourceSlot {

    private volatile SourceImage current;

    public Optional<SourceImage> get() {
        return Optional.ofNullable(current);
    }

    /** @return the previous source, or {@code null} */
    SourceImage replace(SourceImage source) {
        SourceImage prev = current;
        current = source;
        return prev;
    }

    void clear() {
        current = null;
    }
}
