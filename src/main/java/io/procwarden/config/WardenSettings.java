package io.procwarden.config;

import io.procwarden.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public record WardenSettings(
        long staleLockMs,
        long lockRetryDelayMs,
        int lockMaxRetries,
        long killTimeoutMs,
        long pollIntervalMs,
        long killConfirmMs,
        int killParallelism,
        List<String> orphanPatterns,
        List<String> orchestratorPatterns,
        Double cpuPercentCeiling,
        Long memoryMbCeiling,
        long sampleIntervalMs,
        long gracePeriodMs,
        boolean monitorEnabled,
        long staleTestMaxAgeMs,
        long staleTimeoutMs,
        String auditSigningSecret
) {
    private static final Logger log = LoggerFactory.getLogger(WardenSettings.class);

    public static final List<String> DEFAULT_ORPHAN_PATTERNS = List.of(
            "bun test",
            "tail -f",
            "zsh -c -l source.*shell-snapshots",
            "claude",
            "opencode"
    );

    public static final List<String> DEFAULT_ORCHESTRATOR_PATTERNS = List.of(
            "procwarden",
            "loopwork"
    );

    public WardenSettings {
        orphanPatterns = List.copyOf(orphanPatterns);
        orchestratorPatterns = List.copyOf(orchestratorPatterns);
        auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret.trim();
    }

    public static WardenSettings defaults() {
        return new WardenSettings(
                WardenConfig.DEFAULT_STALE_LOCK_MS,
                WardenConfig.DEFAULT_LOCK_RETRY_DELAY_MS,
                WardenConfig.DEFAULT_LOCK_MAX_RETRIES,
                WardenConfig.DEFAULT_KILL_TIMEOUT_MS,
                WardenConfig.DEFAULT_POLL_INTERVAL_MS,
                WardenConfig.DEFAULT_KILL_CONFIRM_MS,
                WardenConfig.DEFAULT_KILL_PARALLELISM,
                DEFAULT_ORPHAN_PATTERNS,
                DEFAULT_ORCHESTRATOR_PATTERNS,
                100.0,
                2_048L,
                WardenConfig.DEFAULT_SAMPLE_INTERVAL_MS,
                WardenConfig.DEFAULT_GRACE_PERIOD_MS,
                true,
                WardenConfig.DEFAULT_STALE_TEST_MAX_AGE_MS,
                WardenConfig.DEFAULT_STALE_TIMEOUT_MS,
                ""
        );
    }

    public static WardenSettings load(Path file) {
        WardenSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            log.warn("Ignoring unreadable settings file {}: {}", file, e.getMessage());
            return defaults;
        }
    }

    static WardenSettings fromFile(SettingsFile file, WardenSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long staleLock = sanitizeLong(file.staleLockMs(), defaults.staleLockMs(), 1_000L);
        long retryDelay = sanitizeLong(file.lockRetryDelayMs(), defaults.lockRetryDelayMs(), 1L);
        int maxRetries = sanitizeInt(file.lockMaxRetries(), defaults.lockMaxRetries(), 1);
        long killTimeout = sanitizeLong(file.killTimeoutMs(), defaults.killTimeoutMs(), 0L);
        long pollInterval = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L);
        long killConfirm = sanitizeLong(file.killConfirmMs(), defaults.killConfirmMs(), 0L);
        int parallelism = sanitizeInt(file.killParallelism(), defaults.killParallelism(), 1);
        List<String> orphanPatterns = sanitizePatterns(file.orphanPatterns(), defaults.orphanPatterns());
        List<String> orchestratorPatterns = sanitizePatterns(file.orchestratorPatterns(), defaults.orchestratorPatterns());
        Double cpuCeiling = file.cpuPercentCeiling() == null ? defaults.cpuPercentCeiling()
                : (file.cpuPercentCeiling() <= 0.0 ? null : file.cpuPercentCeiling());
        Long memoryCeiling = file.memoryMbCeiling() == null ? defaults.memoryMbCeiling()
                : (file.memoryMbCeiling() <= 0L ? null : file.memoryMbCeiling());
        long sampleInterval = sanitizeLong(file.sampleIntervalMs(), defaults.sampleIntervalMs(), 100L);
        long grace = sanitizeLong(file.gracePeriodMs(), defaults.gracePeriodMs(), 0L);
        boolean enabled = file.monitorEnabled() == null ? defaults.monitorEnabled() : file.monitorEnabled();
        long staleTestMaxAge = sanitizeLong(file.staleTestMaxAgeMs(), defaults.staleTestMaxAgeMs(), 0L);
        long staleTimeout = sanitizeLong(file.staleTimeoutMs(), defaults.staleTimeoutMs(), 0L);
        String secret = file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret();
        return new WardenSettings(
                staleLock,
                retryDelay,
                maxRetries,
                killTimeout,
                pollInterval,
                killConfirm,
                parallelism,
                orphanPatterns,
                orchestratorPatterns,
                cpuCeiling,
                memoryCeiling,
                sampleInterval,
                grace,
                enabled,
                staleTestMaxAge,
                staleTimeout,
                secret
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static List<String> sanitizePatterns(List<String> values, List<String> fallback) {
        if (values == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out.isEmpty() ? fallback : out;
    }

    record SettingsFile(
            Long staleLockMs,
            Long lockRetryDelayMs,
            Integer lockMaxRetries,
            Long killTimeoutMs,
            Long pollIntervalMs,
            Long killConfirmMs,
            Integer killParallelism,
            List<String> orphanPatterns,
            List<String> orchestratorPatterns,
            Double cpuPercentCeiling,
            Long memoryMbCeiling,
            Long sampleIntervalMs,
            Long gracePeriodMs,
            Boolean monitorEnabled,
            Long staleTestMaxAgeMs,
            Long staleTimeoutMs,
            String auditSigningSecret
    ) {
    }
}
