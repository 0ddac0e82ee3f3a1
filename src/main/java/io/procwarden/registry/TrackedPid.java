package io.procwarden.registry;

public record TrackedPid(
        long pid,
        String command,
        String spawnedAt,
        String workingDir
) {
    public TrackedPid {
        command = command == null ? "" : command;
        spawnedAt = spawnedAt == null ? "" : spawnedAt;
        workingDir = workingDir == null ? "" : workingDir;
    }
}
