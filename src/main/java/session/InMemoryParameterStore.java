package session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryParameterStore implements ParameterStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> load(String imageId) {
        byte[] b = blobs.get(imageId);
        return b == null ? Optional.empty() : Optional.of(b.clone());
    }

    @Override
    public void save(String imageId, byte[] blob) {
        blobs.put(imageId, blob.clone());
    }

    public int size() {
        return blobs.size();
    }
}
