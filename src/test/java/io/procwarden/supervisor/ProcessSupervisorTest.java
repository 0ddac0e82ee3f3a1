package io.procwarden.supervisor;

import io.procwarden.config.WardenSettings;
import io.procwarden.detect.Classification;
import io.procwarden.detect.OrphanCandidate;
import io.procwarden.detect.ScanOptions;
import io.procwarden.registry.LockSettings;
import io.procwarden.registry.ProcessMetadata;
import io.procwarden.registry.ProcessRecord;
import io.procwarden.registry.ProcessRegistry;
import io.procwarden.registry.ProcessStatus;
import io.procwarden.terminate.KillOptions;
import io.procwarden.terminate.KillOutcome;
import io.procwarden.terminate.ReclaimReport;
import io.procwarden.testing.WardenFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ProcessSupervisorTest {
    @Test
    void reclaimsChildrenLeftBehindByCrashedOrchestrator() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-crash-")) {
            Path project = fx.projectDir();
            fx.table.add(6001L, 5000L, "bun test src/a.test.ts").workingDir(project);
            fx.table.add(6002L, 5000L, "node dev-server.js").workingDir(project);
            ProcessSupervisor first = fx.supervisor();
            first.track(6001L, List.of("bun", "test", "src/a.test.ts"), project.toString());
            first.track(6002L, List.of("node", "dev-server.js"), project.toString());
            Assertions.assertEquals(5000L, fx.registry.get(6001L).orElseThrow().ownerPid());

            // the orchestrator that owned both children is gone; a new one starts
            fx.table.setCurrentPid(5100L);
            ProcessSupervisor second = fx.supervisor();
            List<OrphanCandidate> scanned = second.scan(ScanOptions.forRoot(project));
            Assertions.assertEquals(List.of(6001L, 6002L), scanned.stream().map(OrphanCandidate::pid).toList());
            for (OrphanCandidate candidate : scanned) {
                Assertions.assertEquals(Classification.CONFIRMED, candidate.classification());
                Assertions.assertEquals("lineage broken: owner pid 5000 is gone", candidate.reason());
            }
            Assertions.assertEquals(ProcessStatus.ORPHANED, fx.registry.get(6001L).orElseThrow().status());

            ReclaimReport report = second.reclaim(ScanOptions.forRoot(project), KillOptions.defaults());

            Assertions.assertEquals(List.of(6001L, 6002L), report.outcome().killed());
            Assertions.assertFalse(report.hasFailures());
            Assertions.assertFalse(fx.table.isAlive(6001L));
            Assertions.assertFalse(fx.table.isAlive(6002L));
            Assertions.assertEquals(0, fx.registry.size());
            Assertions.assertTrue(fx.trackedPids.list().isEmpty());

            List<String> audit = fx.auditLogger.tail(10);
            Assertions.assertTrue(audit.get(audit.size() - 1).contains("\"action\":\"reclaim\""));
            Assertions.assertTrue(fx.auditLogger.verifyIntegrity().ok());
        }
    }

    @Test
    void liveOrchestratorChildrenAreNotReclaimed() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-live-")) {
            Path project = fx.projectDir();
            fx.table.add(6101L, 5000L, "bun test").workingDir(project);
            ProcessSupervisor supervisor = fx.supervisor();
            supervisor.track(6101L, List.of("bun", "test"), project.toString());

            ReclaimReport report = supervisor.reclaim(ScanOptions.forRoot(project), KillOptions.defaults());

            Assertions.assertTrue(report.candidates().isEmpty());
            Assertions.assertTrue(fx.table.isAlive(6101L));
            ProcessRecord record = fx.registry.get(6101L).orElseThrow();
            Assertions.assertEquals(ProcessStatus.RUNNING, record.status());
            Assertions.assertTrue(fx.trackedPids.contains(6101L));
            Assertions.assertTrue(fx.table.signalsFor(6101L).isEmpty());
        }
    }

    @Test
    void registeredChildrenSurviveReloadAndAreReclaimedOnceLineageBreaks() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-lineage-")) {
            List<Long> pids = List.of(6151L, 6152L, 6153L);
            for (long pid : pids) {
                fx.table.add(pid, 5000L, "node worker-" + pid + ".js");
                fx.registry.add(pid, new ProcessMetadata("node", List.of("worker-" + pid + ".js"), null, fx.ticker.nowMs()));
            }
            fx.registry.persist();

            ProcessRegistry reloaded = new ProcessRegistry(fx.config.registryFile(), fx.table, LockSettings.defaults(), fx.ticker);
            reloaded.load();
            Assertions.assertEquals(3, reloaded.size());
            ProcessSupervisor supervisor = new ProcessSupervisor(
                    fx.config.namespace(), WardenSettings.defaults(), reloaded, fx.trackedPids, fx.table, fx.ticker, fx.auditLogger);

            Assertions.assertTrue(supervisor.scan(ScanOptions.forRoot(fx.projectDir())).isEmpty());

            // owner 5000 exits; the next scan runs from another pid
            fx.table.setCurrentPid(5100L);
            List<OrphanCandidate> scanned = supervisor.scan(ScanOptions.forRoot(fx.projectDir()));
            Assertions.assertEquals(pids, scanned.stream().map(OrphanCandidate::pid).toList());
            for (OrphanCandidate candidate : scanned) {
                Assertions.assertTrue(candidate.confirmed());
                Assertions.assertTrue(candidate.reason().startsWith("lineage broken"), candidate.reason());
            }

            KillOutcome outcome = supervisor.terminator().kill(scanned, KillOptions.defaults());

            Assertions.assertEquals(pids, outcome.killed());
            Assertions.assertTrue(outcome.failed().isEmpty());
            Assertions.assertEquals(0, reloaded.size());
            for (long pid : pids) {
                Assertions.assertFalse(fx.table.isAlive(pid));
            }
        }
    }

    @Test
    void dryRunReportsWithoutSignalling() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-dry-")) {
            Path project = fx.projectDir();
            fx.table.add(6201L, 1L, "claude --print").workingDir(project);

            ReclaimReport report = fx.supervisor().reclaim(
                    ScanOptions.forRoot(project),
                    KillOptions.defaults().withForce(true).withDryRun(true)
            );

            Assertions.assertEquals(List.of(6201L), report.outcome().killed());
            Assertions.assertTrue(report.outcome().dryRun());
            Assertions.assertTrue(fx.table.signals().isEmpty());
            Assertions.assertTrue(fx.table.isAlive(6201L));
        }
    }

    @Test
    void sweepUsesConfiguredThresholdWhenNoneGiven() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-sweep-")) {
            long now = fx.ticker.nowMs();
            fx.table.add(6301L, 1L, "npx jest").startedAgo(11L * 60_000L, now);
            fx.table.add(6302L, 1L, "npx jest").startedAgo(9L * 60_000L, now);

            ReclaimReport report = fx.supervisor().sweepStaleTests(fx.projectDir(), 0L, false);

            Assertions.assertEquals(List.of(6301L), report.outcome().killed());
            Assertions.assertTrue(fx.table.isAlive(6302L));
        }
    }

    @Test
    void untrackDropsRegistryAndTrackedEntries() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-untrack-")) {
            ProcessSupervisor supervisor = fx.supervisor();
            fx.table.add(6401L, 5000L, "node a.js");
            supervisor.track(6401L, List.of("node", "a.js"), null);

            supervisor.untrack(6401L);
            supervisor.untrack(6401L);

            Assertions.assertFalse(fx.registry.contains(6401L));
            Assertions.assertFalse(fx.trackedPids.contains(6401L));
        }
    }

    @Test
    void spawnedProcessIsForgottenWhenItExits() throws Exception {
        Assumptions.assumeFalse(System.getProperty("os.name", "").toLowerCase().contains("win"));
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-spawn-")) {
            ProcessSupervisor supervisor = fx.supervisor();
            Process process = supervisor.spawn(List.of("/bin/sh", "-c", "exit 0"), fx.projectDir(), false);
            Assertions.assertTrue(process.pid() > 0L);

            process.waitFor();
            long deadline = System.currentTimeMillis() + 5_000L;
            while ((fx.registry.contains(process.pid()) || fx.trackedPids.contains(process.pid()))
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }

            Assertions.assertFalse(fx.registry.contains(process.pid()));
            Assertions.assertFalse(fx.trackedPids.contains(process.pid()));
        }
    }

    @Test
    void spawnRejectsEmptyCommand() throws Exception {
        try (WardenFixture fx = new WardenFixture("procwarden-supervisor-empty-")) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> fx.supervisor().spawn(List.of(), null, false));
        }
    }
}
