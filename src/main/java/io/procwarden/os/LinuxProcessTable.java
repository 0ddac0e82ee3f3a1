package io.procwarden.os;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public final class LinuxProcessTable extends ProcessHandleTable {
    private static final Logger log = LoggerFactory.getLogger(LinuxProcessTable.class);

    private final Path procRoot;

    public LinuxProcessTable() {
        this(Path.of("/proc"));
    }

    LinuxProcessTable(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public Optional<Path> workingDirectory(long pid) {
        try {
            return Optional.of(Files.readSymbolicLink(procRoot.resolve(Long.toString(pid)).resolve("cwd")));
        } catch (IOException | SecurityException e) {
            log.debug("Working directory of pid {} unavailable: {}", pid, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    protected String commandLine(ProcessHandle handle) {
        String fromProc = readCmdline(handle.pid());
        return fromProc.isEmpty() ? super.commandLine(handle) : fromProc;
    }

    @Override
    protected long residentMemoryBytes(long pid) {
        Path status = procRoot.resolve(Long.toString(pid)).resolve("status");
        try {
            List<String> lines = Files.readAllLines(status, StandardCharsets.UTF_8);
            return parseVmRssBytes(lines);
        } catch (IOException | SecurityException e) {
            log.debug("Memory of pid {} unavailable: {}", pid, e.getMessage());
            return 0L;
        }
    }

    static long parseVmRssBytes(List<String> statusLines) {
        for (String line : statusLines) {
            if (!line.startsWith("VmRSS:")) {
                continue;
            }
            String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
            try {
                return Long.parseLong(parts[0]) * 1024L;
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    private String readCmdline(long pid) {
        try {
            byte[] raw = Files.readAllBytes(procRoot.resolve(Long.toString(pid)).resolve("cmdline"));
            return new String(raw, StandardCharsets.UTF_8).replace('\0', ' ').trim();
        } catch (IOException | SecurityException e) {
            return "";
        }
    }
}
