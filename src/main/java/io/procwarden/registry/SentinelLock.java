package io.procwarden.registry;

import io.procwarden.os.ProcessTable;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;

public final class SentinelLock {
    private static final Logger log = LoggerFactory.getLogger(SentinelLock.class);

    private final Path lockPath;
    private final LockSettings settings;
    private final ProcessTable processTable;
    private final Ticker ticker;

    public SentinelLock(Path lockPath, LockSettings settings, ProcessTable processTable, Ticker ticker) {
        this.lockPath = lockPath;
        this.settings = settings;
        this.processTable = processTable;
        this.ticker = ticker;
    }

    public static Path lockPathFor(Path guarded) {
        return guarded.resolveSibling(guarded.getFileName().toString() + ".lock");
    }

    public Path lockPath() {
        return lockPath;
    }

    public <T> T withLock(LockedAction<T> action) throws IOException {
        acquire();
        try {
            return action.run();
        } finally {
            release();
        }
    }

    void acquire() throws IOException {
        Path parent = lockPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String self = Long.toString(processTable.currentPid());
        for (int attempt = 1; attempt <= settings.maxRetries(); attempt++) {
            try {
                Files.writeString(lockPath, self, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                if (attempt > 1) {
                    log.debug("Acquired {} after {} attempts", lockPath, attempt);
                }
                return;
            } catch (FileAlreadyExistsException e) {
                if (breakIfStale()) {
                    continue;
                }
            }
            try {
                ticker.sleep(settings.retryDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistryLockException(lockPath, "Interrupted while waiting for lock: " + lockPath, e);
            }
        }
        throw new RegistryLockException(lockPath,
                "Failed to acquire lock " + lockPath + " after " + settings.maxRetries() + " attempts");
    }

    void release() {
        try {
            OptionalLong owner = readOwner();
            if (owner.isPresent() && owner.getAsLong() != processTable.currentPid()) {
                log.warn("Lock {} was taken over by pid {}, leaving it in place", lockPath, owner.getAsLong());
                return;
            }
            Files.deleteIfExists(lockPath);
        } catch (NoSuchFileException e) {
            log.warn("Lock {} disappeared while held", lockPath);
        } catch (IOException e) {
            log.warn("Failed to release lock {}: {}", lockPath, e.getMessage());
        }
    }

    // True when the lock vanished or was removed and acquisition should retry at once.
    private boolean breakIfStale() {
        try {
            if (describeStaleness() == null) {
                return false;
            }
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            log.debug("Unreadable lock {}: {}", lockPath, e.getMessage());
            return false;
        }
        // Only the holder of the breaker may delete, and only after looking again,
        // so a lock re-created by another breaker since our first look survives.
        Path breaker = breakerPath();
        try {
            Files.writeString(breaker, Long.toString(processTable.currentPid()), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            clearAbandonedBreaker(breaker);
            return false;
        } catch (IOException e) {
            log.warn("Failed to create lock breaker {}: {}", breaker, e.getMessage());
            return false;
        }
        try {
            String staleness;
            try {
                staleness = describeStaleness();
            } catch (NoSuchFileException e) {
                return true;
            }
            if (staleness == null) {
                return false;
            }
            Files.deleteIfExists(lockPath);
            log.info("Removed stale lock {} ({})", lockPath, staleness);
            return true;
        } catch (IOException e) {
            log.warn("Failed to remove stale lock {}: {}", lockPath, e.getMessage());
            return false;
        } finally {
            try {
                Files.deleteIfExists(breaker);
            } catch (IOException e) {
                log.warn("Failed to remove lock breaker {}: {}", breaker, e.getMessage());
            }
        }
    }

    // Null while the lock is held legitimately.
    private String describeStaleness() throws IOException {
        long ageMs = ticker.nowMs() - Files.getLastModifiedTime(lockPath).toMillis();
        OptionalLong owner = readOwner();
        if (owner.isPresent() && !processTable.isAlive(owner.getAsLong())) {
            return "owner " + owner.getAsLong() + " is gone, age=" + ageMs + "ms";
        }
        if (ageMs > settings.staleLockMs()) {
            return "owner=" + (owner.isPresent() ? owner.getAsLong() : "unknown") + ", age=" + ageMs + "ms";
        }
        return null;
    }

    private void clearAbandonedBreaker(Path breaker) {
        try {
            long ageMs = ticker.nowMs() - Files.getLastModifiedTime(breaker).toMillis();
            if (ageMs > settings.staleLockMs()) {
                Files.deleteIfExists(breaker);
                log.info("Removed abandoned lock breaker {} (age={}ms)", breaker, ageMs);
            }
        } catch (NoSuchFileException e) {
            log.trace("Lock breaker {} already gone", breaker);
        } catch (IOException e) {
            log.debug("Unreadable lock breaker {}: {}", breaker, e.getMessage());
        }
    }

    private Path breakerPath() {
        return lockPath.resolveSibling(lockPath.getFileName().toString() + ".break");
    }

    private OptionalLong readOwner() throws IOException {
        String raw = Files.readString(lockPath, StandardCharsets.UTF_8).trim();
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }
}
