package io.procwarden.terminate;

import io.procwarden.config.WardenConfig;

public record KillOptions(boolean force, boolean dryRun, long timeoutMs) {
    public KillOptions {
        if (timeoutMs < 0L) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
    }

    public static KillOptions defaults() {
        return new KillOptions(false, false, WardenConfig.DEFAULT_KILL_TIMEOUT_MS);
    }

    public KillOptions withForce(boolean next) {
        return new KillOptions(next, dryRun, timeoutMs);
    }

    public KillOptions withDryRun(boolean next) {
        return new KillOptions(force, next, timeoutMs);
    }
}
