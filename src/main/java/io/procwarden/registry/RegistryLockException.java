package io.procwarden.registry;

import java.nio.file.Path;

public final class RegistryLockException extends RuntimeException {
    private final Path lockPath;

    public RegistryLockException(Path lockPath, String message) {
        super(message);
        this.lockPath = lockPath;
    }

    public RegistryLockException(Path lockPath, String message, Throwable cause) {
        super(message, cause);
        this.lockPath = lockPath;
    }

    public Path lockPath() {
        return lockPath;
    }
}
