package io.procwarden.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.procwarden.os.ProcessTable;
import io.procwarden.util.Jsons;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ProcessRegistry {
    public static final int SCHEMA_VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    private final Path storagePath;
    private final SentinelLock lock;
    private final ProcessTable processTable;
    private final Ticker ticker;
    private final Map<Long, ProcessRecord> processes = new LinkedHashMap<>();
    // pid -> record to upsert, or null for a removal not yet persisted
    private final Map<Long, ProcessRecord> journal = new LinkedHashMap<>();

    public ProcessRegistry(Path storagePath, ProcessTable processTable, LockSettings lockSettings, Ticker ticker) {
        this.storagePath = storagePath;
        this.processTable = processTable;
        this.ticker = ticker;
        this.lock = new SentinelLock(SentinelLock.lockPathFor(storagePath), lockSettings, processTable, ticker);
    }

    public Path storagePath() {
        return storagePath;
    }

    public synchronized void add(long pid, ProcessMetadata metadata) {
        if (pid <= 0) {
            throw new IllegalArgumentException("pid must be positive: " + pid);
        }
        ProcessRecord record = ProcessRecord.running(pid, metadata, processTable.currentPid());
        processes.put(pid, record);
        journal.put(pid, record);
        log.debug("Registered pid {} ({}) in namespace {}", pid, metadata.command(), metadata.namespace());
        persistQuietly("add");
    }

    public synchronized void remove(long pid) {
        ProcessRecord removed = processes.remove(pid);
        if (removed == null && !journal.containsKey(pid)) {
            return;
        }
        journal.put(pid, null);
        log.debug("Removed pid {} from registry", pid);
        persistQuietly("remove");
    }

    public synchronized void updateStatus(long pid, ProcessStatus status) {
        ProcessRecord current = processes.get(pid);
        if (current == null || current.status() == status) {
            return;
        }
        ProcessRecord next = current.withStatus(status);
        processes.put(pid, next);
        journal.put(pid, next);
        log.debug("Pid {} status {} -> {}", pid, current.status().wireName(), status.wireName());
        persistQuietly("status update");
    }

    public synchronized void clear() {
        if (processes.isEmpty()) {
            return;
        }
        for (Long pid : processes.keySet()) {
            journal.put(pid, null);
        }
        processes.clear();
        persistQuietly("clear");
    }

    public synchronized Optional<ProcessRecord> get(long pid) {
        return Optional.ofNullable(processes.get(pid));
    }

    public synchronized boolean contains(long pid) {
        return processes.containsKey(pid);
    }

    public synchronized List<ProcessRecord> list() {
        return List.copyOf(processes.values());
    }

    public synchronized List<ProcessRecord> listByNamespace(String namespace) {
        List<ProcessRecord> out = new ArrayList<>();
        for (ProcessRecord record : processes.values()) {
            if (record.namespace().equals(namespace)) {
                out.add(record);
            }
        }
        return out;
    }

    public synchronized int size() {
        return processes.size();
    }

    public synchronized void persist() throws IOException {
        lock.withLock(() -> {
            Map<Long, ProcessRecord> merged;
            try {
                merged = readSnapshotRecords();
            } catch (IllegalStateException e) {
                log.error("Overwriting unreadable registry snapshot {}: {}", storagePath, e.getMessage());
                merged = new LinkedHashMap<>(processes);
            }
            applyJournal(merged);
            RegistrySnapshot snapshot = new RegistrySnapshot(
                    SCHEMA_VERSION,
                    processTable.currentPid(),
                    new ArrayList<>(merged.values()),
                    ticker.nowMs()
            );
            JsonFiles.writeAtomically(storagePath, snapshot, false);
            journal.clear();
            processes.clear();
            processes.putAll(merged);
            return null;
        });
    }

    // Unpersisted changes survive a reload.
    public synchronized void load() throws IOException {
        Map<Long, ProcessRecord> loaded = readSnapshotRecords();
        applyJournal(loaded);
        processes.clear();
        processes.putAll(loaded);
        log.debug("Loaded {} process records from {}", processes.size(), storagePath);
    }

    private Map<Long, ProcessRecord> readSnapshotRecords() throws IOException {
        Map<Long, ProcessRecord> out = new LinkedHashMap<>();
        if (!Files.exists(storagePath)) {
            return out;
        }
        RegistrySnapshot snapshot;
        try {
            snapshot = Jsons.mapper().readValue(storagePath.toFile(), RegistrySnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed registry snapshot " + storagePath + ": " + e.getOriginalMessage(), e);
        }
        if (snapshot.schemaVersion() < 1 || snapshot.schemaVersion() > SCHEMA_VERSION) {
            throw new IllegalStateException("Unsupported registry schema version: " + snapshot.schemaVersion());
        }
        for (ProcessRecord record : snapshot.processes()) {
            out.put(record.pid(), record);
        }
        return out;
    }

    private void applyJournal(Map<Long, ProcessRecord> target) {
        for (Map.Entry<Long, ProcessRecord> entry : journal.entrySet()) {
            if (entry.getValue() == null) {
                target.remove(entry.getKey());
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private void persistQuietly(String operation) {
        try {
            persist();
        } catch (IOException e) {
            log.error("Failed to persist registry after {}: {}", operation, e.getMessage());
        }
    }
}
