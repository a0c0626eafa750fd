package io.kairos.core.scheduler;

import java.io.IOException;
import java.nio.file.Path;

public final class JobStoreException extends IOException {
    private final Path path;

    public JobStoreException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
