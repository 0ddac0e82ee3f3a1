package io.procwarden.os;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PsProcessTable extends ProcessHandleTable {
    private static final Logger log = LoggerFactory.getLogger(PsProcessTable.class);
    private static final long COMMAND_TIMEOUT_MS = 5_000L;
    private static final Pattern PS_ROW = Pattern.compile("^\\s*(\\d+)\\s+(\\d+)\\s+(\\S+)\\s+(\\d+)\\s+(.*)$");
    private static final Pattern USAGE_ROW = Pattern.compile("^\\s*([0-9.,]+)\\s+(\\d+)\\s*$");

    @Override
    public List<OsProcess> listProcesses() {
        Optional<String> output = run(List.of("ps", "-axo", "pid=,ppid=,etime=,rss=,command="));
        if (output.isEmpty()) {
            log.warn("ps listing failed, falling back to ProcessHandle view");
            return super.listProcesses();
        }
        return parsePsRows(output.get());
    }

    @Override
    public Optional<OsProcess> describe(long pid) {
        if (pid <= 0) {
            return Optional.empty();
        }
        return run(List.of("ps", "-o", "pid=,ppid=,etime=,rss=,command=", "-p", Long.toString(pid)))
                .map(PsProcessTable::parsePsRows)
                .flatMap(rows -> rows.stream().filter(row -> row.pid() == pid).findFirst());
    }

    @Override
    public ResourceUsage usage(long pid) {
        Optional<String> output = run(List.of("ps", "-o", "%cpu=,rss=", "-p", Long.toString(pid)));
        if (output.isEmpty()) {
            log.debug("Usage sampling failed for pid {}, reporting 0", pid);
            return ResourceUsage.zero(pid);
        }
        return parseUsage(pid, output.get());
    }

    @Override
    public Optional<Path> workingDirectory(long pid) {
        return run(List.of("lsof", "-a", "-p", Long.toString(pid), "-d", "cwd", "-Fn"))
                .flatMap(PsProcessTable::parseLsofCwd);
    }

    @Override
    protected long residentMemoryBytes(long pid) {
        return usage(pid).residentMemoryBytes();
    }

    static List<OsProcess> parsePsRows(String output) {
        List<OsProcess> rows = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Matcher m = PS_ROW.matcher(line);
            if (!m.matches()) {
                continue;
            }
            try {
                rows.add(new OsProcess(
                        Long.parseLong(m.group(1)),
                        Long.parseLong(m.group(2)),
                        m.group(5).trim(),
                        ElapsedTime.parseMillis(m.group(3)),
                        Long.parseLong(m.group(4)) * 1024L
                ));
            } catch (NumberFormatException ignored) {
                // Not a process row.
            }
        }
        return rows;
    }

    static ResourceUsage parseUsage(long pid, String output) {
        for (String line : output.split("\\R")) {
            Matcher m = USAGE_ROW.matcher(line);
            if (!m.matches()) {
                continue;
            }
            try {
                double cpu = Double.parseDouble(m.group(1).replace(',', '.'));
                long rssKb = Long.parseLong(m.group(2));
                return new ResourceUsage(pid, cpu, rssKb * 1024L);
            } catch (NumberFormatException e) {
                return ResourceUsage.zero(pid);
            }
        }
        return ResourceUsage.zero(pid);
    }

    static Optional<Path> parseLsofCwd(String output) {
        for (String line : output.split("\\R")) {
            if (line.startsWith("n") && line.length() > 1) {
                return Optional.of(Path.of(line.substring(1)));
            }
        }
        return Optional.empty();
    }

    private Optional<String> run(List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.debug("{} unavailable: {}", command.get(0), e.getMessage());
            return Optional.empty();
        }
        try {
            String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            boolean finished = process.waitFor(COMMAND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return Optional.empty();
            }
            return process.exitValue() == 0 ? Optional.of(out) : Optional.empty();
        } catch (IOException e) {
            process.destroyForcibly();
            log.debug("{} failed: {}", command.get(0), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
