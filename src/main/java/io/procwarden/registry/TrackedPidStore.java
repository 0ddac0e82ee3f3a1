package io.procwarden.registry;

import io.procwarden.os.ProcessTable;
import io.procwarden.util.Jsons;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TrackedPidStore {
    private static final Logger log = LoggerFactory.getLogger(TrackedPidStore.class);

    private final Path file;
    private final SentinelLock lock;
    private final Ticker ticker;

    public TrackedPidStore(Path file, ProcessTable processTable, LockSettings lockSettings, Ticker ticker) {
        this.file = file;
        this.ticker = ticker;
        this.lock = new SentinelLock(SentinelLock.lockPathFor(file), lockSettings, processTable, ticker);
    }

    public Path file() {
        return file;
    }

    public synchronized void track(long pid, String command, String workingDir) throws IOException {
        if (pid <= 0) {
            throw new IllegalArgumentException("pid must be positive: " + pid);
        }
        lock.withLock(() -> {
            List<TrackedPid> pids = read(true);
            for (TrackedPid existing : pids) {
                if (existing.pid() == pid) {
                    return null;
                }
            }
            pids.add(new TrackedPid(pid, command, Instant.ofEpochMilli(ticker.nowMs()).toString(), workingDir));
            write(pids);
            return null;
        });
    }

    public synchronized void untrack(long pid) throws IOException {
        lock.withLock(() -> {
            List<TrackedPid> pids = read(false);
            if (pids.removeIf(p -> p.pid() == pid)) {
                write(pids);
            }
            return null;
        });
    }

    public List<TrackedPid> list() {
        return List.copyOf(read(false));
    }

    public boolean contains(long pid) {
        for (TrackedPid tracked : read(false)) {
            if (tracked.pid() == pid) {
                return true;
            }
        }
        return false;
    }

    public synchronized int pruneDead(ProcessTable processTable) throws IOException {
        return lock.withLock(() -> {
            List<TrackedPid> pids = read(false);
            int before = pids.size();
            pids.removeIf(p -> !processTable.isAlive(p.pid()));
            int removed = before - pids.size();
            if (removed > 0) {
                write(pids);
                log.debug("Pruned {} dead tracked pids", removed);
            }
            return removed;
        });
    }

    // With overwriting set, the caller writes whatever this returns back to the file.
    private List<TrackedPid> read(boolean overwriting) {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            TrackedFile parsed = Jsons.mapper().readValue(file.toFile(), TrackedFile.class);
            return parsed.pids() == null ? new ArrayList<>() : new ArrayList<>(parsed.pids());
        } catch (IOException e) {
            if (overwriting) {
                log.warn("Tracked pid file {} is unreadable and will be overwritten; its entries are lost: {}",
                        file, e.getMessage());
            } else {
                log.debug("Tracked pid file {} unreadable, treating as empty: {}", file, e.getMessage());
            }
            return new ArrayList<>();
        }
    }

    private void write(List<TrackedPid> pids) throws IOException {
        JsonFiles.writeAtomically(file, new TrackedFile(pids), true);
    }

    record TrackedFile(List<TrackedPid> pids) {
    }
}
