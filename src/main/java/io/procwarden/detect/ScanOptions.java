package io.procwarden.detect;

import java.nio.file.Path;
import java.util.List;

public record ScanOptions(
        Path rootPath,
        List<String> patterns,
        List<String> extraPatterns,
        long minAgeMs
) {
    public ScanOptions {
        rootPath = rootPath == null ? Path.of("").toAbsolutePath() : rootPath.toAbsolutePath().normalize();
        patterns = patterns == null ? null : List.copyOf(patterns);
        extraPatterns = extraPatterns == null ? List.of() : List.copyOf(extraPatterns);
        minAgeMs = Math.max(0L, minAgeMs);
    }

    public static ScanOptions defaults() {
        return new ScanOptions(null, null, List.of(), 0L);
    }

    public static ScanOptions forRoot(Path rootPath) {
        return new ScanOptions(rootPath, null, List.of(), 0L);
    }
}
