package io.procwarden.monitor;

import io.procwarden.os.ProcessTable;
import io.procwarden.os.ResourceUsage;
import io.procwarden.registry.ProcessRecord;
import io.procwarden.registry.ProcessRegistry;
import io.procwarden.registry.RegistryLockException;
import io.procwarden.terminate.ProcessTerminator;
import io.procwarden.terminate.TerminationResult;
import io.procwarden.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public final class ResourceMonitor {
    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);
    private static final long STOP_MARGIN_MS = 1_000L;

    private final ProcessRegistry registry;
    private final ProcessTable processTable;
    private final ProcessTerminator terminator;
    private final Ticker ticker;
    private final ResourceLimits limits;
    private final long killTimeoutMs;
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong terminated = new AtomicLong();
    private ScheduledExecutorService scheduler;

    public ResourceMonitor(
            ProcessRegistry registry,
            ProcessTable processTable,
            ProcessTerminator terminator,
            Ticker ticker,
            ResourceLimits limits,
            long killTimeoutMs
    ) {
        this.registry = registry;
        this.processTable = processTable;
        this.terminator = terminator;
        this.ticker = ticker;
        this.limits = limits;
        this.killTimeoutMs = killTimeoutMs;
    }

    public ResourceLimits limits() {
        return limits;
    }

    public synchronized void start() {
        if (!limits.enabled()) {
            log.info("Resource monitor disabled");
            return;
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, "procwarden-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeTick, 0L, limits.sampleIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Resource monitor started (interval={}ms, cpu={}, memoryMb={})",
                limits.sampleIntervalMs(), limits.cpuPercentCeiling(), limits.memoryMbCeiling());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        // a tick in flight may be escalating; let it reach SIGKILL and its confirmation
        scheduler.shutdown();
        long waitMs = killTimeoutMs + terminator.killConfirmMs() + STOP_MARGIN_MS;
        try {
            if (!scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Resource monitor did not stop within {}ms", waitMs);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Resource monitor stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public TickResult tick() {
        ticks.incrementAndGet();
        long now = ticker.nowMs();
        int sampled = 0;
        List<Long> removed = new ArrayList<>();
        List<Long> killed = new ArrayList<>();
        List<Long> tolerated = new ArrayList<>();
        for (ProcessRecord record : registry.list()) {
            long pid = record.pid();
            if (!processTable.isAlive(pid)) {
                registry.remove(pid);
                removed.add(pid);
                continue;
            }
            ResourceUsage usage = sample(pid);
            sampled++;
            String violation = limits.violation(usage.cpuPercent(), usage.residentMemoryMb());
            if (violation == null) {
                continue;
            }
            if (now - record.startTime() < limits.gracePeriodMs()) {
                log.debug("Pid {} over limits ({}) but within grace period", pid, violation);
                tolerated.add(pid);
                continue;
            }
            if (!registry.contains(pid)) {
                log.debug("Pid {} already cleaned up", pid);
                continue;
            }
            log.warn("Pid {} ({}) exceeded limits: {}", pid, record.command(), violation);
            TerminationResult result = terminator.terminate(pid, killTimeoutMs);
            if (result.isKilled()) {
                terminated.incrementAndGet();
                killed.add(pid);
            } else if (result.error() != null) {
                log.error("Failed to terminate pid {}: {}", pid, result.error());
            }
        }
        return new TickResult(sampled, removed, tolerated, killed);
    }

    public MonitorStats stats() {
        return new MonitorStats(ticks.get(), terminated.get(), limits.enabled(), isRunning(), limits);
    }

    private ResourceUsage sample(long pid) {
        try {
            return processTable.usage(pid);
        } catch (RuntimeException e) {
            log.debug("Sampling pid {} failed, treating as idle: {}", pid, e.getMessage());
            return ResourceUsage.zero(pid);
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RegistryLockException e) {
            log.error("Monitor tick could not update registry: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Monitor tick failed", e);
        }
    }

    public record TickResult(int sampled, List<Long> removed, List<Long> tolerated, List<Long> killed) {
        public TickResult {
            removed = List.copyOf(removed);
            tolerated = List.copyOf(tolerated);
            killed = List.copyOf(killed);
        }
    }

    public record MonitorStats(long ticks, long terminated, boolean enabled, boolean running, ResourceLimits limits) {
    }
}
