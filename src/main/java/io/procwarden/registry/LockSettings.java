package io.procwarden.registry;

import io.procwarden.config.WardenConfig;

public record LockSettings(long staleLockMs, long retryDelayMs, int maxRetries) {
    public LockSettings {
        if (staleLockMs <= 0L || retryDelayMs < 0L || maxRetries < 1) {
            throw new IllegalArgumentException("invalid lock settings");
        }
    }

    public static LockSettings defaults() {
        return new LockSettings(
                WardenConfig.DEFAULT_STALE_LOCK_MS,
                WardenConfig.DEFAULT_LOCK_RETRY_DELAY_MS,
                WardenConfig.DEFAULT_LOCK_MAX_RETRIES
        );
    }
}
