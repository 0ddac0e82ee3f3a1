package io.procwarden.testing;

import io.procwarden.config.WardenConfig;
import io.procwarden.config.WardenSettings;
import io.procwarden.observability.AuditLogger;
import io.procwarden.registry.LockSettings;
import io.procwarden.registry.ProcessRegistry;
import io.procwarden.registry.SentinelLock;
import io.procwarden.registry.TrackedPidStore;
import io.procwarden.supervisor.ProcessSupervisor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A procwarden root in a temp directory backed by a fake process table.
 */
public final class WardenFixture implements AutoCloseable {
    public final Path root;
    public final WardenConfig config;
    public final FakeTicker ticker;
    public final FakeProcessTable table;
    public final ProcessRegistry registry;
    public final TrackedPidStore trackedPids;
    public final AuditLogger auditLogger;

    public WardenFixture(String prefix) throws IOException {
        this.root = Files.createTempDirectory(prefix);
        this.config = WardenConfig.fromRoot(root.resolve(".procwarden").toString());
        this.ticker = new FakeTicker();
        this.table = new FakeProcessTable(ticker);
        this.registry = new ProcessRegistry(config.registryFile(), table, LockSettings.defaults(), ticker);
        this.trackedPids = new TrackedPidStore(config.trackedPidsFile(), table, LockSettings.defaults(), ticker);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), "",
                new SentinelLock(SentinelLock.lockPathFor(config.auditFile()), LockSettings.defaults(), table, ticker));
    }

    public Path projectDir() {
        return root;
    }

    public ProcessSupervisor supervisor() {
        return supervisor(WardenSettings.defaults());
    }

    public ProcessSupervisor supervisor(WardenSettings settings) {
        return new ProcessSupervisor(config.namespace(), settings, registry, trackedPids, table, ticker, auditLogger);
    }

    @Override
    public void close() throws IOException {
        TestFiles.deleteRecursively(root);
    }
}
