package io.procwarden.os;

public record ResourceUsage(
        long pid,
        double cpuPercent,
        long residentMemoryBytes
) {
    public static ResourceUsage zero(long pid) {
        return new ResourceUsage(pid, 0.0, 0L);
    }

    public double residentMemoryMb() {
        return residentMemoryBytes / (1024.0 * 1024.0);
    }
}
