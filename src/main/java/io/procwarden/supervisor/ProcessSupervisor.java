package io.procwarden.supervisor;

import io.procwarden.config.WardenConfig;
import io.procwarden.config.WardenSettings;
import io.procwarden.detect.OrphanCandidate;
import io.procwarden.detect.OrphanDetector;
import io.procwarden.detect.ScanOptions;
import io.procwarden.monitor.ResourceLimits;
import io.procwarden.monitor.ResourceMonitor;
import io.procwarden.observability.AuditLogger;
import io.procwarden.os.ProcessTable;
import io.procwarden.os.ProcessTables;
import io.procwarden.registry.LockSettings;
import io.procwarden.registry.ProcessMetadata;
import io.procwarden.registry.ProcessRegistry;
import io.procwarden.registry.RegistryLockException;
import io.procwarden.registry.SentinelLock;
import io.procwarden.registry.TrackedPidStore;
import io.procwarden.terminate.KillOptions;
import io.procwarden.terminate.KillOutcome;
import io.procwarden.terminate.ProcessTerminator;
import io.procwarden.terminate.ReclaimReport;
import io.procwarden.terminate.StaleTestSweeper;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ProcessSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final String ACTOR = "supervisor";

    private final String namespace;
    private final WardenSettings settings;
    private final ProcessRegistry registry;
    private final TrackedPidStore trackedPids;
    private final ProcessTable processTable;
    private final Ticker ticker;
    private final AuditLogger auditLogger;
    private final OrphanDetector detector;
    private final ProcessTerminator terminator;
    private final StaleTestSweeper sweeper;
    private final ResourceMonitor monitor;

    public ProcessSupervisor(
            String namespace,
            WardenSettings settings,
            ProcessRegistry registry,
            TrackedPidStore trackedPids,
            ProcessTable processTable,
            Ticker ticker,
            AuditLogger auditLogger
    ) {
        this.namespace = WardenConfig.sanitizeNamespace(namespace);
        this.settings = settings;
        this.registry = registry;
        this.trackedPids = trackedPids;
        this.processTable = processTable;
        this.ticker = ticker;
        this.auditLogger = auditLogger;
        this.detector = new OrphanDetector(
                registry,
                trackedPids,
                processTable,
                ticker,
                settings.orphanPatterns(),
                settings.orchestratorPatterns(),
                settings.staleTimeoutMs()
        );
        this.terminator = new ProcessTerminator(
                registry,
                trackedPids,
                processTable,
                ticker,
                auditLogger,
                settings.pollIntervalMs(),
                settings.killConfirmMs(),
                settings.killParallelism()
        );
        this.sweeper = new StaleTestSweeper(detector, terminator, settings.killTimeoutMs());
        this.monitor = new ResourceMonitor(
                registry,
                processTable,
                terminator,
                ticker,
                ResourceLimits.fromSettings(settings),
                settings.killTimeoutMs()
        );
    }

    public static ProcessSupervisor open(WardenConfig config) throws IOException {
        return open(config, WardenSettings.load(config.settingsFile()));
    }

    public static ProcessSupervisor open(WardenConfig config, WardenSettings settings) throws IOException {
        return open(config, settings, ProcessTables.forCurrentPlatform(), Ticker.SYSTEM);
    }

    public static ProcessSupervisor open(
            WardenConfig config,
            WardenSettings settings,
            ProcessTable processTable,
            Ticker ticker
    ) throws IOException {
        LockSettings lockSettings = new LockSettings(
                settings.staleLockMs(),
                settings.lockRetryDelayMs(),
                settings.lockMaxRetries()
        );
        ProcessRegistry registry = new ProcessRegistry(config.registryFile(), processTable, lockSettings, ticker);
        registry.load();
        TrackedPidStore trackedPids = new TrackedPidStore(config.trackedPidsFile(), processTable, lockSettings, ticker);
        AuditLogger auditLogger = new AuditLogger(
                config.auditFile(),
                config.namespace(),
                settings.auditSigningSecret(),
                new SentinelLock(SentinelLock.lockPathFor(config.auditFile()), lockSettings, processTable, ticker)
        );
        log.debug("Opened procwarden root {} (namespace {})", config.rootDir(), config.namespace());
        return new ProcessSupervisor(
                config.namespace(),
                settings,
                registry,
                trackedPids,
                processTable,
                ticker,
                auditLogger
        );
    }

    public Process spawn(List<String> command, Path workingDir, boolean inheritIo) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        if (inheritIo) {
            pb.inheritIO();
        }
        Process process = pb.start();
        long pid = process.pid();
        String dir = workingDir == null ? Path.of("").toAbsolutePath().toString() : workingDir.toAbsolutePath().toString();
        track(pid, command, dir);
        process.onExit().thenAccept(exited -> forgetExited(pid));
        return process;
    }

    public void track(long pid, List<String> command, String workingDir) throws IOException {
        ProcessMetadata metadata = new ProcessMetadata(
                command.get(0),
                command.subList(1, command.size()),
                namespace,
                ticker.nowMs()
        );
        registry.add(pid, metadata);
        trackedPids.track(pid, String.join(" ", command), workingDir);
        auditLogger.log(AuditLogger.AuditEvent.forPid("process.track", ACTOR, pid, "ok", Map.of(
                "command", String.join(" ", command),
                "working_dir", workingDir == null ? "" : workingDir
        )));
    }

    public void untrack(long pid) throws IOException {
        registry.remove(pid);
        trackedPids.untrack(pid);
    }

    public List<OrphanCandidate> scan(ScanOptions options) {
        return detector.scan(options);
    }

    public ReclaimReport reclaim(ScanOptions scanOptions, KillOptions killOptions) {
        List<OrphanCandidate> candidates = detector.scan(scanOptions);
        KillOutcome outcome = terminator.kill(candidates, killOptions);
        auditSummary("reclaim", candidates.size(), outcome);
        return new ReclaimReport(candidates, outcome);
    }

    public ReclaimReport sweepStaleTests(Path rootPath, long maxAgeMs, boolean dryRun) {
        long threshold = maxAgeMs > 0L ? maxAgeMs : settings.staleTestMaxAgeMs();
        ReclaimReport report = sweeper.sweep(rootPath, threshold, dryRun);
        auditSummary("sweep_tests", report.candidates().size(), report.outcome());
        return report;
    }

    public ResourceMonitor monitor() {
        return monitor;
    }

    public ResourceMonitor monitor(ResourceLimits limits) {
        return new ResourceMonitor(registry, processTable, terminator, ticker, limits, settings.killTimeoutMs());
    }

    public ProcessRegistry registry() {
        return registry;
    }

    public TrackedPidStore trackedPids() {
        return trackedPids;
    }

    public ProcessTerminator terminator() {
        return terminator;
    }

    public StaleTestSweeper sweeper() {
        return sweeper;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public WardenSettings settings() {
        return settings;
    }

    public String namespace() {
        return namespace;
    }

    @Override
    public void close() {
        monitor.stop();
    }

    private void forgetExited(long pid) {
        try {
            untrack(pid);
            log.debug("Supervised pid {} exited", pid);
        } catch (IOException | RegistryLockException e) {
            log.warn("Failed to forget exited pid {}: {}", pid, e.getMessage());
        }
    }

    private void auditSummary(String action, int candidates, KillOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("candidates", candidates);
        details.put("killed", outcome.killed().size());
        details.put("skipped", outcome.skipped().size());
        details.put("failed", outcome.failed().size());
        details.put("dry_run", outcome.dryRun());
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                ACTOR,
                "namespace/" + namespace,
                outcome.hasFailures() ? "partial" : "ok",
                details
        ));
    }
}
