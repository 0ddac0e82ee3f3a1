package io.procwarden.detect;

import io.procwarden.os.OsProcess;
import io.procwarden.os.ProcessTable;
import io.procwarden.registry.ProcessRecord;
import io.procwarden.registry.ProcessRegistry;
import io.procwarden.registry.ProcessStatus;
import io.procwarden.registry.TrackedPid;
import io.procwarden.registry.TrackedPidStore;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class OrphanDetector {
    public static final long MIN_SIGNALLABLE_PID = 100L;

    private static final Logger log = LoggerFactory.getLogger(OrphanDetector.class);

    private final ProcessRegistry registry;
    private final TrackedPidStore trackedPids;
    private final ProcessTable processTable;
    private final Ticker ticker;
    private final List<String> defaultPatterns;
    private final List<CommandPattern> orchestratorPatterns;
    private final long staleTimeoutMs;

    public OrphanDetector(
            ProcessRegistry registry,
            TrackedPidStore trackedPids,
            ProcessTable processTable,
            Ticker ticker,
            List<String> defaultPatterns,
            List<String> orchestratorPatterns,
            long staleTimeoutMs
    ) {
        this.registry = registry;
        this.trackedPids = trackedPids;
        this.processTable = processTable;
        this.ticker = ticker;
        this.defaultPatterns = List.copyOf(defaultPatterns);
        this.orchestratorPatterns = CommandPattern.compileAll(orchestratorPatterns);
        this.staleTimeoutMs = staleTimeoutMs;
    }

    public List<String> defaultPatterns() {
        return defaultPatterns;
    }

    public List<OrphanCandidate> scan(ScanOptions options) {
        Map<Long, OrphanCandidate> found = new LinkedHashMap<>();
        Map<Long, OsProcess> table = new LinkedHashMap<>();
        for (OsProcess row : processTable.listProcesses()) {
            table.put(row.pid(), row);
        }
        List<ProcessRecord> records = registry.list();

        scanRegistry(records, table, found);
        List<TrackedPid> tracked = trackedPids.list();
        scanTracked(tracked, records, table, found);
        scanHeuristics(options, records, tracked, table, found);

        try {
            trackedPids.pruneDead(processTable);
        } catch (IOException e) {
            log.warn("Failed to prune tracked pid file {}: {}", trackedPids.file(), e.getMessage());
        }
        log.debug("Scan found {} candidates", found.size());
        return new ArrayList<>(found.values());
    }

    private void scanRegistry(List<ProcessRecord> records, Map<Long, OsProcess> table, Map<Long, OrphanCandidate> found) {
        for (ProcessRecord record : records) {
            long pid = record.pid();
            long runningMs = ticker.nowMs() - record.startTime();
            String reason;
            if (!processTable.isAlive(pid)) {
                reason = "process exited; stale registry entry";
            } else if (record.ownerPid() > 0 && !processTable.isAlive(record.ownerPid())) {
                reason = "lineage broken: owner pid " + record.ownerPid() + " is gone";
            } else if (staleTimeoutMs > 0L && runningMs > staleTimeoutMs * 2L) {
                reason = "stale: running " + runningMs + "ms, over twice the " + staleTimeoutMs + "ms timeout";
            } else {
                continue;
            }
            registry.updateStatus(pid, ProcessStatus.ORPHANED);
            OsProcess row = table.get(pid);
            long ageMs = row != null ? row.ageMs() : Math.max(0L, runningMs);
            found.put(pid, new OrphanCandidate(
                    pid,
                    row != null && !row.command().isEmpty() ? row.command() : record.commandLine(),
                    ageMs,
                    row != null ? row.residentMemoryBytes() : 0L,
                    workingDirectory(pid).map(Path::toString).orElse(null),
                    Classification.CONFIRMED,
                    reason
            ));
        }
    }

    private void scanTracked(
            List<TrackedPid> tracked,
            List<ProcessRecord> records,
            Map<Long, OsProcess> table,
            Map<Long, OrphanCandidate> found
    ) {
        Set<Long> supervised = supervisedByLiveOwner(records);
        for (TrackedPid entry : tracked) {
            long pid = entry.pid();
            if (found.containsKey(pid) || supervised.contains(pid) || !processTable.isAlive(pid)) {
                continue;
            }
            OsProcess row = table.get(pid);
            String workingDir = entry.workingDir().isEmpty()
                    ? workingDirectory(pid).map(Path::toString).orElse(null)
                    : entry.workingDir();
            found.put(pid, new OrphanCandidate(
                    pid,
                    row != null && !row.command().isEmpty() ? row.command() : entry.command(),
                    row != null ? row.ageMs() : 0L,
                    row != null ? row.residentMemoryBytes() : 0L,
                    workingDir,
                    Classification.CONFIRMED,
                    "tracked spawn"
            ));
        }
    }

    private void scanHeuristics(
            ScanOptions options,
            List<ProcessRecord> records,
            List<TrackedPid> tracked,
            Map<Long, OsProcess> table,
            Map<Long, OrphanCandidate> found
    ) {
        List<String> sources = new ArrayList<>(options.patterns() != null ? options.patterns() : defaultPatterns);
        sources.addAll(options.extraPatterns());
        List<CommandPattern> patterns = CommandPattern.compileAll(sources);
        if (patterns.isEmpty()) {
            return;
        }

        Set<Long> excluded = new HashSet<>(ancestry(processTable.currentPid(), table));
        excluded.add(processTable.currentPid());
        excluded.addAll(supervisedByLiveOwner(records));
        Set<Long> registryPids = new HashSet<>();
        Set<Long> ownerPids = new HashSet<>();
        for (ProcessRecord record : records) {
            registryPids.add(record.pid());
            ownerPids.add(record.ownerPid());
        }
        Set<Long> trackedSet = new HashSet<>();
        for (TrackedPid entry : tracked) {
            trackedSet.add(entry.pid());
        }

        for (OsProcess row : table.values()) {
            long pid = row.pid();
            if (pid <= MIN_SIGNALLABLE_PID || excluded.contains(pid) || found.containsKey(pid)) {
                continue;
            }
            if (!matchesAny(patterns, row.command())) {
                continue;
            }
            if (!processTable.isAlive(pid) || row.ageMs() < options.minAgeMs()) {
                continue;
            }
            Optional<Path> workingDir = workingDirectory(pid);
            found.put(pid, classify(row, workingDir, options.rootPath(), trackedSet, registryPids, ownerPids, table));
        }
    }

    private OrphanCandidate classify(
            OsProcess row,
            Optional<Path> workingDir,
            Path rootPath,
            Set<Long> trackedSet,
            Set<Long> registryPids,
            Set<Long> ownerPids,
            Map<Long, OsProcess> table
    ) {
        List<Long> ancestors = ancestry(row.pid(), table);
        boolean inProject = workingDir.map(dir -> dir.toAbsolutePath().normalize().startsWith(rootPath)).orElse(false);

        Classification classification;
        String reason;
        Long registeredAncestor = firstMember(ancestors, registryPids);
        if (trackedSet.contains(row.pid())) {
            classification = Classification.CONFIRMED;
            reason = "tracked spawn";
        } else if (registeredAncestor != null) {
            classification = Classification.CONFIRMED;
            reason = "descendant of registered pid " + registeredAncestor;
        } else if (inProject && reachesOrchestrator(ancestors, ownerPids, table)) {
            classification = Classification.CONFIRMED;
            reason = "orchestrator descendant in project directory";
        } else if (inProject) {
            classification = Classification.SUSPECTED;
            reason = "matches pattern in project directory but not tracked";
        } else {
            classification = Classification.SUSPECTED;
            reason = "matches pattern; working directory unknown or outside project";
        }
        return new OrphanCandidate(
                row.pid(),
                row.command(),
                row.ageMs(),
                row.residentMemoryBytes(),
                workingDir.map(Path::toString).orElse(null),
                classification,
                reason
        );
    }

    // Registry owner pids mark lineage; command names count only when no ancestor carries one.
    private boolean reachesOrchestrator(List<Long> ancestors, Set<Long> ownerPids, Map<Long, OsProcess> table) {
        if (firstMember(ancestors, ownerPids) != null) {
            return true;
        }
        for (Long ancestor : ancestors) {
            OsProcess row = lookup(ancestor, table);
            if (row != null && matchesAny(orchestratorPatterns, row.command())) {
                return true;
            }
        }
        return false;
    }

    // Registry pids whose registering orchestrator is still running.
    private Set<Long> supervisedByLiveOwner(List<ProcessRecord> records) {
        Set<Long> out = new HashSet<>();
        for (ProcessRecord record : records) {
            if (record.ownerPid() > 0 && processTable.isAlive(record.ownerPid())) {
                out.add(record.pid());
            }
        }
        return out;
    }

    // Nearest first, excluding init.
    private List<Long> ancestry(long pid, Map<Long, OsProcess> table) {
        List<Long> out = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        visited.add(pid);
        OsProcess current = lookup(pid, table);
        while (current != null) {
            long parent = current.parentPid();
            if (parent <= 1L || !visited.add(parent)) {
                break;
            }
            out.add(parent);
            current = lookup(parent, table);
        }
        return out;
    }

    private OsProcess lookup(long pid, Map<Long, OsProcess> table) {
        OsProcess row = table.get(pid);
        if (row != null) {
            return row;
        }
        return processTable.describe(pid).orElse(null);
    }

    private Optional<Path> workingDirectory(long pid) {
        try {
            return processTable.workingDirectory(pid);
        } catch (RuntimeException e) {
            log.debug("Working directory lookup for pid {} failed: {}", pid, e.getMessage());
            return Optional.empty();
        }
    }

    private static Long firstMember(List<Long> pids, Set<Long> set) {
        for (Long pid : pids) {
            if (set.contains(pid)) {
                return pid;
            }
        }
        return null;
    }

    private static boolean matchesAny(List<CommandPattern> patterns, String command) {
        for (CommandPattern pattern : patterns) {
            if (pattern.matches(command)) {
                return true;
            }
        }
        return false;
    }
}
