package io.procwarden.detect;

public record OrphanCandidate(
        long pid,
        String command,
        long ageMs,
        long residentMemoryBytes,
        String workingDir,
        Classification classification,
        String reason
) {
    public boolean confirmed() {
        return classification == Classification.CONFIRMED;
    }
}
