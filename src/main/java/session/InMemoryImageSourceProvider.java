package session;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryImageSourceProvider implements ImageSourceProvider {

    private final Map<String, Path> paths = new ConcurrentHashMap<>();

    public InMemoryImageSourceProvider register(String imageId, Path path) {
        paths.put(imageId, path);
        return this;
    }

    @Override
    public Optional<Path> resolve(String imageId) {
        return Optional.ofNullable(paths.get(imageId));
    }
}
