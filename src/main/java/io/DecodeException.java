package io;

import java.io.IOException;
import java.nio.file.Path;

/** A source file that is missing, corrupt or in an unsupported format. Not retryable. */
public class DecodeException extends IOException {

    private final Path source;

    public DecodeException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public DecodeException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
