package io.procwarden.monitor;

import io.procwarden.config.WardenConfig;
import io.procwarden.config.WardenSettings;

import java.util.Locale;

public record ResourceLimits(
        Double cpuPercentCeiling,
        Long memoryMbCeiling,
        long sampleIntervalMs,
        long gracePeriodMs,
        boolean enabled
) {
    public ResourceLimits {
        if (sampleIntervalMs <= 0L) {
            throw new IllegalArgumentException("sampleIntervalMs must be > 0");
        }
        if (gracePeriodMs < 0L) {
            throw new IllegalArgumentException("gracePeriodMs must be >= 0");
        }
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(
                null,
                null,
                WardenConfig.DEFAULT_SAMPLE_INTERVAL_MS,
                WardenConfig.DEFAULT_GRACE_PERIOD_MS,
                true
        );
    }

    public static ResourceLimits fromSettings(WardenSettings settings) {
        return new ResourceLimits(
                settings.cpuPercentCeiling(),
                settings.memoryMbCeiling(),
                settings.sampleIntervalMs(),
                settings.gracePeriodMs(),
                settings.monitorEnabled()
        );
    }

    public ResourceLimits withCeilings(Double cpuPercent, Long memoryMb) {
        return new ResourceLimits(cpuPercent, memoryMb, sampleIntervalMs, gracePeriodMs, enabled);
    }

    public ResourceLimits withTiming(long nextSampleIntervalMs, long nextGracePeriodMs) {
        return new ResourceLimits(cpuPercentCeiling, memoryMbCeiling, nextSampleIntervalMs, nextGracePeriodMs, enabled);
    }

    public String violation(double cpuPercent, double residentMemoryMb) {
        if (cpuPercentCeiling != null && cpuPercent > cpuPercentCeiling) {
            return String.format(Locale.ROOT, "cpu %.1f%% > %.1f%%", cpuPercent, cpuPercentCeiling);
        }
        if (memoryMbCeiling != null && residentMemoryMb > memoryMbCeiling) {
            return String.format(Locale.ROOT, "memory %.0fMB > %dMB", residentMemoryMb, memoryMbCeiling);
        }
        return null;
    }
}
