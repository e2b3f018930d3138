package session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Keeps each image's parameters in a {@code <image>.params} file next to it. */
public final class SidecarParameterStore implements ParameterStore {

    public static final String SUFFIX = ".params";

    private final ImageSourceProvider sources;

    public SidecarParameterStore(ImageSourceProvider sources) {
        this.sources = sources;
    }

    @Override
    public Optional<byte[]> load(String imageId) throws IOException {
        Optional<Path> sidecar = sidecar(imageId);
        if (sidecar.isEmpty() || !Files.isRegularFile(sidecar.get()))
            return Optional.empty();
        return Optional.of(Files.readAllBytes(sidecar.get()));
    }

    @Override
    public void save(String imageId, byte[] blob) throws IOException {
        Path p = sidecar(imageId).orElseThrow(() -> new IOException("Unknown image id: " + imageId));
        Files.write(p, blob);
    }

    private Optional<Path> sidecar(String imageId) {
        return sources.resolve(imageId).map(p -> p.resolveSibling(p.getFileName() + SUFFIX));
    }
}
