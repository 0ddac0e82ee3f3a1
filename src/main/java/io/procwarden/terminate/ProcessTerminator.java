package io.procwarden.terminate;

import io.procwarden.detect.OrphanCandidate;
import io.procwarden.detect.OrphanDetector;
import io.procwarden.observability.AuditLogger;
import io.procwarden.os.ProcessSignalException;
import io.procwarden.os.ProcessTable;
import io.procwarden.os.Signal;
import io.procwarden.registry.ProcessRegistry;
import io.procwarden.registry.RegistryLockException;
import io.procwarden.registry.TrackedPidStore;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public final class ProcessTerminator {
    private static final Logger log = LoggerFactory.getLogger(ProcessTerminator.class);
    private static final String ACTOR = "terminator";

    private final ProcessRegistry registry;
    private final TrackedPidStore trackedPids;
    private final ProcessTable processTable;
    private final Ticker ticker;
    private final AuditLogger auditLogger;
    private final long pollIntervalMs;
    private final long killConfirmMs;
    private final int parallelism;

    public ProcessTerminator(
            ProcessRegistry registry,
            TrackedPidStore trackedPids,
            ProcessTable processTable,
            Ticker ticker,
            AuditLogger auditLogger,
            long pollIntervalMs,
            long killConfirmMs,
            int parallelism
    ) {
        if (pollIntervalMs <= 0L || killConfirmMs < 0L || parallelism < 1) {
            throw new IllegalArgumentException("invalid terminator settings");
        }
        this.registry = registry;
        this.trackedPids = trackedPids;
        this.processTable = processTable;
        this.ticker = ticker;
        this.auditLogger = auditLogger;
        this.pollIntervalMs = pollIntervalMs;
        this.killConfirmMs = killConfirmMs;
        this.parallelism = parallelism;
    }

    public KillOutcome kill(List<OrphanCandidate> candidates, KillOptions options) {
        if (candidates.isEmpty()) {
            return KillOutcome.empty(options.dryRun());
        }
        List<TerminationResult> results = new ArrayList<>();
        if (parallelism == 1 || candidates.size() == 1) {
            for (OrphanCandidate candidate : candidates) {
                results.add(killOne(candidate, options));
            }
        } else {
            results.addAll(killInParallel(candidates, options));
        }

        List<Long> killed = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        List<KillOutcome.KillFailure> failed = new ArrayList<>();
        for (TerminationResult result : results) {
            switch (result.status()) {
                case KILLED -> killed.add(result.pid());
                case SKIPPED -> skipped.add(result.pid());
                case FAILED -> failed.add(new KillOutcome.KillFailure(result.pid(), result.error()));
            }
        }
        log.info("Kill batch finished: killed={} skipped={} failed={} dryRun={}",
                killed.size(), skipped.size(), failed.size(), options.dryRun());
        return new KillOutcome(killed, skipped, failed, options.dryRun());
    }

    public TerminationResult terminate(long pid, long timeoutMs) {
        if (pid <= OrphanDetector.MIN_SIGNALLABLE_PID) {
            log.warn("Refusing to signal protected pid {}", pid);
            audit(pid, "skipped", Map.of("reason", "protected pid"));
            return TerminationResult.skipped(pid);
        }
        return escalate(pid, timeoutMs, Map.of());
    }

    public long killConfirmMs() {
        return killConfirmMs;
    }

    private List<TerminationResult> killInParallel(List<OrphanCandidate> candidates, KillOptions options) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, candidates.size()));
        try {
            List<Future<TerminationResult>> futures = new ArrayList<>();
            for (OrphanCandidate candidate : candidates) {
                futures.add(pool.submit(() -> killOne(candidate, options)));
            }
            List<TerminationResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                long pid = candidates.get(i).pid();
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("Termination of pid {} failed unexpectedly", pid, cause);
                    results.add(TerminationResult.failed(pid, String.valueOf(cause.getMessage())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.add(TerminationResult.failed(pid, "interrupted"));
                }
            }
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private TerminationResult killOne(OrphanCandidate candidate, KillOptions options) {
        long pid = candidate.pid();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", candidate.command());
        details.put("classification", candidate.classification().wireName());
        details.put("reason", candidate.reason());
        details.put("dry_run", options.dryRun());

        if (pid <= OrphanDetector.MIN_SIGNALLABLE_PID) {
            log.warn("Refusing to signal protected pid {}", pid);
            audit(pid, "skipped", withEntry(details, "skip_reason", "protected pid"));
            return TerminationResult.skipped(pid);
        }
        if (!candidate.confirmed() && !options.force()) {
            log.debug("Skipping suspected pid {} without force", pid);
            audit(pid, "skipped", withEntry(details, "skip_reason", "suspected without force"));
            return TerminationResult.skipped(pid);
        }
        if (!processTable.isAlive(pid)) {
            forget(pid);
            audit(pid, "killed", withEntry(details, "note", "already exited"));
            return TerminationResult.killed(pid);
        }
        if (options.dryRun()) {
            audit(pid, "would_kill", details);
            return TerminationResult.killed(pid);
        }
        return escalate(pid, options.timeoutMs(), details);
    }

    // The caller's interrupt is restored only after the audit row is written.
    private TerminationResult escalate(long pid, long timeoutMs, Map<String, Object> details) {
        Escalation escalation = new Escalation(pid, Thread.interrupted());
        try {
            TerminationResult result = escalation.run(timeoutMs);
            audit(pid, result.status().name().toLowerCase(Locale.ROOT), failureDetails(result, details));
            return result;
        } finally {
            if (escalation.interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // Null when the signal was delivered, otherwise the final result.
    private TerminationResult send(long pid, Signal signal) {
        try {
            processTable.signal(pid, signal);
            log.debug("Sent {} to pid {}", signal.label(), pid);
            return null;
        } catch (ProcessSignalException e) {
            switch (e.reason()) {
                case NO_SUCH_PROCESS:
                    forget(pid);
                    return TerminationResult.killed(pid);
                case PERMISSION_DENIED:
                    log.warn("No permission to send {} to pid {}", signal.label(), pid);
                    return TerminationResult.failed(pid, "permission denied");
                default:
                    log.warn("Failed to send {} to pid {}: {}", signal.label(), pid, e.getMessage());
                    return TerminationResult.failed(pid, e.getMessage());
            }
        }
    }

    private void forget(long pid) {
        try {
            registry.remove(pid);
        } catch (RegistryLockException e) {
            log.error("Pid {} is gone but its registry entry could not be removed: {}", pid, e.getMessage());
        }
        try {
            trackedPids.untrack(pid);
        } catch (IOException | RegistryLockException e) {
            log.warn("Failed to untrack pid {}: {}", pid, e.getMessage());
        }
    }

    private void audit(long pid, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.forPid("process.kill", ACTOR, pid, result, details));
        } catch (UncheckedIOException | RegistryLockException e) {
            log.warn("Failed to audit kill decision for pid {}: {}", pid, e.getMessage());
        }
    }

    private static Map<String, Object> failureDetails(TerminationResult result, Map<String, Object> details) {
        if (result.error() == null) {
            return details;
        }
        return withEntry(details, "error", result.error());
    }

    private static Map<String, Object> withEntry(Map<String, Object> details, String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>(details);
        out.put(key, value);
        return out;
    }

    // Once SIGTERM is out the run goes to its end; an interrupt is only remembered.
    private final class Escalation {
        private final long pid;
        private boolean interrupted;

        private Escalation(long pid, boolean interrupted) {
            this.pid = pid;
            this.interrupted = interrupted;
        }

        private TerminationResult run(long timeoutMs) {
            if (!processTable.isAlive(pid)) {
                forget(pid);
                return TerminationResult.killed(pid);
            }
            TerminationResult termFailure = send(pid, Signal.TERM);
            if (termFailure != null) {
                return termFailure;
            }
            if (waitForExit(timeoutMs)) {
                log.info("Pid {} exited after SIGTERM", pid);
                forget(pid);
                return TerminationResult.killed(pid);
            }
            log.info("Pid {} still alive after {}ms, sending SIGKILL", pid, timeoutMs);
            TerminationResult killFailure = send(pid, Signal.KILL);
            if (killFailure != null) {
                return killFailure;
            }
            if (waitForExit(killConfirmMs)) {
                forget(pid);
                return TerminationResult.killed(pid);
            }
            log.error("Pid {} survived SIGKILL", pid);
            return TerminationResult.failed(pid, "process survived SIGKILL");
        }

        private boolean waitForExit(long timeoutMs) {
            long deadline = ticker.nowMs() + timeoutMs;
            while (true) {
                if (!processTable.isAlive(pid)) {
                    return true;
                }
                long remaining = deadline - ticker.nowMs();
                if (remaining <= 0L) {
                    return false;
                }
                try {
                    ticker.sleep(Math.min(pollIntervalMs, remaining));
                } catch (InterruptedException e) {
                    log.debug("Interrupted while waiting on pid {}; finishing escalation", pid);
                    interrupted = true;
                }
            }
        }
    }
}
