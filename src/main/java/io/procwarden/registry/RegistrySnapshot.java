package io.procwarden.registry;

import java.util.List;

public record RegistrySnapshot(
        int schemaVersion,
        long writerPid,
        List<ProcessRecord> processes,
        long lastUpdated
) {
    public RegistrySnapshot {
        processes = processes == null ? List.of() : List.copyOf(processes);
    }
}
