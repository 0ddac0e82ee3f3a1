package io.procwarden.os;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface ProcessTable {

    List<OsProcess> listProcesses();

    Optional<OsProcess> describe(long pid);

    boolean isAlive(long pid);

    ResourceUsage usage(long pid);

    Optional<Path> workingDirectory(long pid);

    void signal(long pid, Signal signal) throws ProcessSignalException;

    default long currentPid() {
        return ProcessHandle.current().pid();
    }
}
