package io.procwarden.cli;

import io.procwarden.config.WardenConfig;
import io.procwarden.config.WardenSettings;
import io.procwarden.detect.ScanOptions;
import io.procwarden.monitor.ResourceLimits;
import io.procwarden.monitor.ResourceMonitor;
import io.procwarden.observability.AuditLogger;
import io.procwarden.os.ProcessTable;
import io.procwarden.os.ProcessTables;
import io.procwarden.registry.ProcessRecord;
import io.procwarden.security.SensitiveDataMasker;
import io.procwarden.supervisor.ProcessSupervisor;
import io.procwarden.terminate.KillOptions;
import io.procwarden.terminate.ReclaimReport;
import io.procwarden.terminate.TerminationResult;
import io.procwarden.util.Jsons;
import io.procwarden.util.Ticker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "procwarden",
        mixinStandardHelpOptions = true,
        description = "Supervise and reclaim processes spawned by AI task runners",
        subcommands = {
                WardenCommand.ReclaimCommand.class,
                WardenCommand.ProcessesCommand.class,
                WardenCommand.RunCommand.class,
                WardenCommand.MonitorCommand.class,
                WardenCommand.SweepTestsCommand.class,
                WardenCommand.AuditTailCommand.class,
                WardenCommand.AuditVerifyCommand.class
        }
)
public final class WardenCommand implements Runnable {
    @Option(names = {"--root"}, description = "Procwarden state directory", defaultValue = WardenConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (one orchestrator scope)", defaultValue = WardenConfig.DEFAULT_NAMESPACE)
    String namespace;

    // Overridden by tests.
    ProcessTable processTable;
    Ticker ticker = Ticker.SYSTEM;

    @Override
    public void run() {
        System.out.println("Use subcommands: reclaim | processes | run | monitor | sweep-tests | audit-tail | audit-verify");
    }

    WardenConfig config() {
        return WardenConfig.fromRoot(root, namespace);
    }

    ProcessSupervisor supervisor() throws IOException {
        WardenConfig config = config();
        WardenSettings settings = WardenSettings.load(config.settingsFile());
        ProcessTable table = processTable != null ? processTable : ProcessTables.forCurrentPlatform();
        return ProcessSupervisor.open(config, settings, table, ticker);
    }

    @Command(name = "reclaim", description = "Find orphaned processes and terminate them")
    static final class ReclaimCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--force"}, defaultValue = "false", description = "Also kill suspected orphans")
        boolean force;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Show what would be killed without sending signals")
        boolean dryRun;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print the result as JSON")
        boolean json;

        @Option(names = {"--min-age-ms"}, defaultValue = "0", description = "Ignore pattern matches younger than this")
        long minAgeMs;

        @Option(names = {"--pattern"}, description = "Additional command pattern (repeatable)")
        List<String> patterns = new ArrayList<>();

        @Option(names = {"--project-root"}, defaultValue = ".", description = "Project directory used to classify matches")
        String projectRoot;

        @Option(names = {"--timeout-ms"}, defaultValue = "5000", description = "Wait after SIGTERM before SIGKILL")
        long timeoutMs;

        @Override
        public Integer call() throws Exception {
            try (ProcessSupervisor supervisor = parent.supervisor()) {
                ScanOptions scan = new ScanOptions(Paths.get(projectRoot), null, patterns, minAgeMs);
                ReclaimReport report = supervisor.reclaim(scan, new KillOptions(force, dryRun, timeoutMs));
                if (json) {
                    System.out.println(Jsons.toJson(OrphanTable.toJson(report)));
                } else if (report.candidates().isEmpty()) {
                    System.out.println("No orphan processes found");
                } else {
                    System.out.print(OrphanTable.render(report, force));
                }
                return report.hasFailures() ? 1 : 0;
            }
        }
    }

    @Command(name = "processes", description = "List processes in the registry")
    static final class ProcessesCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--all-namespaces"}, defaultValue = "false", description = "Include every namespace")
        boolean allNamespaces;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print records as JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            try (ProcessSupervisor supervisor = parent.supervisor()) {
                List<ProcessRecord> records = allNamespaces
                        ? supervisor.registry().list()
                        : supervisor.registry().listByNamespace(supervisor.namespace());
                if (json) {
                    System.out.println(Jsons.toJson(records));
                    return 0;
                }
                if (records.isEmpty()) {
                    System.out.println("No processes registered");
                    return 0;
                }
                for (ProcessRecord record : records) {
                    System.out.printf("%-7d %-10s %-12s %s%n",
                            record.pid(),
                            record.status().wireName(),
                            record.namespace(),
                            SensitiveDataMasker.maskCommandLine(record.commandLine()));
                }
                return 0;
            }
        }
    }

    @Command(name = "run", description = "Run a command as a supervised child and wait for it")
    static final class RunCommand implements Callable<Integer> {
        static final int TIMEOUT_EXIT_CODE = 124;

        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--timeout-ms"}, defaultValue = "0", description = "Terminate the child after this long; 0 waits forever")
        long timeoutMs;

        @Parameters(arity = "1..*", description = "Command and arguments")
        List<String> command;

        @Override
        public Integer call() throws Exception {
            try (ProcessSupervisor supervisor = parent.supervisor()) {
                Process child = supervisor.spawn(command, null, true);
                long pid = child.pid();
                long killTimeoutMs = supervisor.settings().killTimeoutMs();
                Thread hook = new Thread(() -> {
                    if (child.isAlive()) {
                        supervisor.terminator().terminate(pid, killTimeoutMs);
                    }
                }, "procwarden-run-shutdown-hook");
                Runtime.getRuntime().addShutdownHook(hook);
                try {
                    if (timeoutMs > 0L) {
                        if (!child.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                            TerminationResult result = supervisor.terminator().terminate(pid, killTimeoutMs);
                            System.err.println("procwarden: pid " + pid + " timed out after " + timeoutMs
                                    + "ms (" + result.status().name().toLowerCase(Locale.ROOT) + ")");
                            return TIMEOUT_EXIT_CODE;
                        }
                    } else {
                        child.waitFor();
                    }
                    supervisor.untrack(pid);
                    return child.exitValue();
                } finally {
                    Runtime.getRuntime().removeShutdownHook(hook);
                }
            }
        }
    }

    @Command(name = "monitor", description = "Terminate registered processes that exceed CPU or memory ceilings")
    static final class MonitorCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--cpu-percent"}, description = "CPU ceiling in percent; default from settings")
        Double cpuPercent;

        @Option(names = {"--memory-mb"}, description = "Resident memory ceiling in MB; default from settings")
        Long memoryMb;

        @Option(names = {"--interval-ms"}, description = "Sampling interval; default from settings")
        Long intervalMs;

        @Option(names = {"--grace-ms"}, description = "Grace period after spawn; default from settings")
        Long graceMs;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single sampling pass")
        boolean once;

        @Override
        public Integer call() throws Exception {
            try (ProcessSupervisor supervisor = parent.supervisor()) {
                ResourceLimits base = ResourceLimits.fromSettings(supervisor.settings());
                ResourceLimits limits = base
                        .withCeilings(
                                cpuPercent != null ? cpuPercent : base.cpuPercentCeiling(),
                                memoryMb != null ? memoryMb : base.memoryMbCeiling())
                        .withTiming(
                                intervalMs != null ? intervalMs : base.sampleIntervalMs(),
                                graceMs != null ? graceMs : base.gracePeriodMs());
                ResourceMonitor monitor = supervisor.monitor(limits);
                if (once) {
                    System.out.println(Jsons.toJson(monitor.tick()));
                    return 0;
                }
                if (!limits.enabled()) {
                    System.out.println("Resource monitor is disabled in settings");
                    return 0;
                }
                AtomicBoolean running = new AtomicBoolean(true);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    running.set(false);
                    monitor.stop();
                }, "procwarden-monitor-shutdown-hook"));
                monitor.start();
                while (running.get()) {
                    Thread.sleep(limits.sampleIntervalMs());
                    System.out.println(Jsons.toCompactJson(monitor.stats()));
                }
                return 0;
            }
        }
    }

    @Command(name = "sweep-tests", description = "Force-kill test runners older than a threshold")
    static final class SweepTestsCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--max-age-ms"}, defaultValue = "0", description = "Age threshold; 0 uses settings")
        long maxAgeMs;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Show what would be killed without sending signals")
        boolean dryRun;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print the result as JSON")
        boolean json;

        @Option(names = {"--project-root"}, defaultValue = ".", description = "Project directory used to classify matches")
        String projectRoot;

        @Override
        public Integer call() throws Exception {
            try (ProcessSupervisor supervisor = parent.supervisor()) {
                ReclaimReport report = supervisor.sweepStaleTests(Paths.get(projectRoot), maxAgeMs, dryRun);
                if (json) {
                    System.out.println(Jsons.toJson(OrphanTable.toJson(report)));
                } else if (report.candidates().isEmpty()) {
                    System.out.println("No stale test processes found");
                } else {
                    System.out.print(OrphanTable.render(report, true));
                }
                return report.hasFailures() ? 1 : 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            WardenConfig config = parent.config();
            AuditLogger auditLogger = new AuditLogger(config.auditFile(), config.namespace(), "");
            for (String row : auditLogger.tail(lines)) {
                System.out.println(row);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Check the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() {
            WardenConfig config = parent.config();
            WardenSettings settings = WardenSettings.load(config.settingsFile());
            AuditLogger auditLogger = new AuditLogger(config.auditFile(), config.namespace(), settings.auditSigningSecret());
            AuditLogger.AuditIntegrityOutcome outcome = auditLogger.verifyIntegrity();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("file", config.auditFile().toString());
            out.put("outcome", outcome);
            System.out.println(Jsons.toJson(out));
            return outcome.ok() ? 0 : 1;
        }
    }
}
