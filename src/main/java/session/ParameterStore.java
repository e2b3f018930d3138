package session;

import java.io.IOException;
import java.util.Optional;

/** Persists opaque parameter blobs keyed by image id. */
public interface ParameterStore {

    Optional<byte[]> load(String imageId) throws IOException;

    void save(String imageId, byte[] blob) throws IOException;
}
