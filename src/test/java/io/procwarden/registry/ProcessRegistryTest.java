package io.procwarden.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.procwarden.testing.FakeProcessTable;
import io.procwarden.testing.FakeTicker;
import io.procwarden.testing.TestFiles;
import io.procwarden.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ProcessRegistryTest {

    @Test
    void addedRecordsSurviveReload() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-reload-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path file = root.resolve("processes.json");
            ProcessRegistry registry = new ProcessRegistry(file, table, LockSettings.defaults(), ticker);

            registry.add(1234L, new ProcessMetadata("bun", List.of("test", "--watch"), "default", 1_000L));

            ProcessRegistry reloaded = new ProcessRegistry(file, table, LockSettings.defaults(), ticker);
            reloaded.load();
            ProcessRecord record = reloaded.get(1234L).orElseThrow();
            Assertions.assertEquals("bun test --watch", record.commandLine());
            Assertions.assertEquals(ProcessStatus.RUNNING, record.status());
            Assertions.assertEquals(table.currentPid(), record.ownerPid());
            Assertions.assertEquals(1_000L, record.startTime());

            JsonNode snapshot = Jsons.mapper().readTree(file.toFile());
            Assertions.assertEquals(ProcessRegistry.SCHEMA_VERSION, snapshot.path("schemaVersion").asInt());
            Assertions.assertEquals("running", snapshot.path("processes").get(0).path("status").asText());
            Assertions.assertFalse(Files.exists(SentinelLock.lockPathFor(file)));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void removeIsIdempotent() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-remove-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            ProcessRegistry registry = new ProcessRegistry(root.resolve("processes.json"), table, LockSettings.defaults(), ticker);
            registry.add(2001L, new ProcessMetadata("tail", List.of("-f", "log"), null, 0L));

            registry.remove(2001L);
            registry.remove(2001L);
            registry.remove(4242L);

            Assertions.assertTrue(registry.list().isEmpty());
            registry.load();
            Assertions.assertTrue(registry.list().isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void statusUpdateIsPersistedInLowerCase() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-status-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path file = root.resolve("processes.json");
            ProcessRegistry registry = new ProcessRegistry(file, table, LockSettings.defaults(), ticker);
            registry.add(2002L, new ProcessMetadata("claude", List.of(), "default", 0L));

            registry.updateStatus(2002L, ProcessStatus.ORPHANED);
            registry.updateStatus(9999L, ProcessStatus.ORPHANED);

            Assertions.assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("\"orphaned\""));
            Assertions.assertEquals(1, registry.size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void missingSnapshotLoadsEmpty() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-missing-");
        try {
            FakeTicker ticker = new FakeTicker();
            ProcessRegistry registry = new ProcessRegistry(
                    root.resolve("nested").resolve("processes.json"), new FakeProcessTable(ticker), LockSettings.defaults(), ticker);
            registry.load();
            Assertions.assertEquals(0, registry.size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void malformedOrFutureSnapshotIsRejected() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-bad-");
        try {
            FakeTicker ticker = new FakeTicker();
            Path file = root.resolve("processes.json");
            ProcessRegistry registry = new ProcessRegistry(file, new FakeProcessTable(ticker), LockSettings.defaults(), ticker);

            Files.writeString(file, "{\"schemaVersion\": 9, \"processes\": []}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, registry::load);

            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, registry::load);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void concurrentInstancesMergeInsteadOfOverwriting() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-merge-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path file = root.resolve("processes.json");
            ProcessRegistry first = new ProcessRegistry(file, table, LockSettings.defaults(), ticker);
            ProcessRegistry second = new ProcessRegistry(file, table, LockSettings.defaults(), ticker);

            first.add(3001L, new ProcessMetadata("bun", List.of("test"), "default", 0L));
            second.add(3002L, new ProcessMetadata("opencode", List.of(), "ci", 0L));
            second.remove(3001L);
            first.add(3003L, new ProcessMetadata("tail", List.of("-f"), "default", 0L));

            ProcessRegistry reader = new ProcessRegistry(file, table, LockSettings.defaults(), ticker);
            reader.load();
            Assertions.assertTrue(reader.get(3001L).isEmpty());
            Assertions.assertTrue(reader.get(3002L).isPresent());
            Assertions.assertTrue(reader.get(3003L).isPresent());
            Assertions.assertEquals(1, reader.listByNamespace("ci").size());
            Assertions.assertEquals(List.of(3002L, 3003L), first.list().stream().map(ProcessRecord::pid).toList());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void rejectsNonPositivePid() throws Exception {
        Path root = Files.createTempDirectory("procwarden-registry-pid-");
        try {
            FakeTicker ticker = new FakeTicker();
            ProcessRegistry registry = new ProcessRegistry(
                    root.resolve("processes.json"), new FakeProcessTable(ticker), LockSettings.defaults(), ticker);
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> registry.add(0L, new ProcessMetadata("bun", List.of(), null, 0L)));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> new ProcessMetadata(" ", List.of(), null, 0L));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
