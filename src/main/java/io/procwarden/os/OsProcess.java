package io.procwarden.os;

public record OsProcess(
        long pid,
        long parentPid,
        String command,
        long ageMs,
        long residentMemoryBytes
) {
    public OsProcess {
        command = command == null ? "" : command;
    }
}
