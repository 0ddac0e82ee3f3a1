package io.procwarden.os;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public class ProcessHandleTable implements ProcessTable {
    private static final Logger log = LoggerFactory.getLogger(ProcessHandleTable.class);

    @Override
    public List<OsProcess> listProcesses() {
        List<OsProcess> out = new ArrayList<>();
        try (Stream<ProcessHandle> all = ProcessHandle.allProcesses()) {
            all.forEach(handle -> out.add(toOsProcess(handle)));
        }
        return out;
    }

    @Override
    public Optional<OsProcess> describe(long pid) {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .map(this::toOsProcess);
    }

    @Override
    public boolean isAlive(long pid) {
        if (pid <= 0) {
            return false;
        }
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public ResourceUsage usage(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return ResourceUsage.zero(pid);
        }
        return new ResourceUsage(pid, cpuPercent(handle.get()), residentMemoryBytes(pid));
    }

    @Override
    public Optional<Path> workingDirectory(long pid) {
        return Optional.empty();
    }

    @Override
    public void signal(long pid, Signal signal) throws ProcessSignalException {
        ProcessHandle handle = ProcessHandle.of(pid)
                .orElseThrow(() -> new ProcessSignalException(
                        pid, ProcessSignalException.Reason.NO_SUCH_PROCESS, "no such process"));
        boolean delivered;
        try {
            delivered = signal == Signal.KILL ? handle.destroyForcibly() : handle.destroy();
        } catch (IllegalStateException | UnsupportedOperationException | SecurityException e) {
            throw new ProcessSignalException(
                    pid, ProcessSignalException.Reason.OS_ERROR, signal.label() + " rejected: " + e.getMessage(), e);
        }
        if (delivered) {
            return;
        }
        if (!handle.isAlive()) {
            throw new ProcessSignalException(pid, ProcessSignalException.Reason.NO_SUCH_PROCESS, "no such process");
        }
        throw new ProcessSignalException(pid, ProcessSignalException.Reason.PERMISSION_DENIED, "permission denied");
    }

    protected OsProcess toOsProcess(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        long parent = handle.parent().map(ProcessHandle::pid).orElse(0L);
        long ageMs = info.startInstant()
                .map(start -> Math.max(0L, Duration.between(start, Instant.now()).toMillis()))
                .orElse(0L);
        return new OsProcess(handle.pid(), parent, commandLine(handle), ageMs, residentMemoryBytes(handle.pid()));
    }

    protected String commandLine(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        return info.commandLine().orElseGet(() -> info.command().orElse(""));
    }

    protected long residentMemoryBytes(long pid) {
        return 0L;
    }

    // Lifetime average, the figure ps -o %cpu prints.
    protected double cpuPercent(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        Optional<Duration> cpu = info.totalCpuDuration();
        Optional<Instant> start = info.startInstant();
        if (cpu.isEmpty() || start.isEmpty()) {
            log.debug("CPU sampling unsupported for pid {}, reporting 0", handle.pid());
            return 0.0;
        }
        long wallMs = Duration.between(start.get(), Instant.now()).toMillis();
        if (wallMs <= 0L) {
            return 0.0;
        }
        return cpu.get().toMillis() * 100.0 / wallMs;
    }
}
