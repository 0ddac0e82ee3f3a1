package io.procwarden.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class WardenConfig {
    public static final String DEFAULT_ROOT = ".procwarden";
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final long DEFAULT_STALE_LOCK_MS = 30_000L;
    public static final long DEFAULT_LOCK_RETRY_DELAY_MS = 100L;
    public static final int DEFAULT_LOCK_MAX_RETRIES = 50;
    public static final long DEFAULT_KILL_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 100L;
    public static final long DEFAULT_KILL_CONFIRM_MS = 1_000L;
    public static final int DEFAULT_KILL_PARALLELISM = 4;
    public static final long DEFAULT_SAMPLE_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_GRACE_PERIOD_MS = 5_000L;
    public static final long DEFAULT_STALE_TEST_MAX_AGE_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_STALE_TIMEOUT_MS = 5L * 60L * 1000L;

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public WardenConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static WardenConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static WardenConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new WardenConfig(scoped, base, safeNamespace);
    }

    public static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    // Shared by every namespace under one root; records carry their own namespace.
    public Path registryFile() {
        return rootBaseDir.resolve("processes.json");
    }

    public Path trackedPidsFile() {
        return rootBaseDir.resolve("spawned-pids.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("procwarden-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
