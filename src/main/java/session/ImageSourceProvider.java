package session;

import java.nio.file.Path;
import java.util.Optional;

/** Resolves an image id to the file holding its source. */
public interface ImageSourceProvider {

    Optional<Path> resolve(String imageId);
}
