package io.procwarden.terminate;

import io.procwarden.config.WardenConfig;
import io.procwarden.detect.CommandPattern;
import io.procwarden.detect.OrphanCandidate;
import io.procwarden.detect.OrphanDetector;
import io.procwarden.detect.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class StaleTestSweeper {
    public static final List<String> TEST_RUNNER_PATTERNS = List.of(
            "bun test",
            "jest",
            "vitest",
            "mocha",
            "npm test",
            "pnpm test",
            "yarn test",
            "npx jest",
            "npx vitest",
            "npx mocha"
    );

    private static final Logger log = LoggerFactory.getLogger(StaleTestSweeper.class);

    private final OrphanDetector detector;
    private final ProcessTerminator terminator;
    private final List<String> patterns;
    private final List<CommandPattern> compiled;
    private final long killTimeoutMs;

    public StaleTestSweeper(OrphanDetector detector, ProcessTerminator terminator, long killTimeoutMs) {
        this(detector, terminator, TEST_RUNNER_PATTERNS, killTimeoutMs);
    }

    public StaleTestSweeper(OrphanDetector detector, ProcessTerminator terminator, List<String> patterns, long killTimeoutMs) {
        this.detector = detector;
        this.terminator = terminator;
        this.patterns = List.copyOf(patterns);
        this.compiled = CommandPattern.compileAll(patterns);
        this.killTimeoutMs = killTimeoutMs;
    }

    public List<String> patterns() {
        return new ArrayList<>(patterns);
    }

    public List<OrphanCandidate> findStale(Path rootPath, long maxAgeMs) {
        long threshold = maxAgeMs > 0L ? maxAgeMs : WardenConfig.DEFAULT_STALE_TEST_MAX_AGE_MS;
        List<OrphanCandidate> out = new ArrayList<>();
        for (OrphanCandidate candidate : detector.scan(new ScanOptions(rootPath, patterns, List.of(), threshold))) {
            if (candidate.ageMs() >= threshold && isTestRunner(candidate.command())) {
                out.add(candidate);
            }
        }
        return out;
    }

    public ReclaimReport sweep(Path rootPath, long maxAgeMs, boolean dryRun) {
        List<OrphanCandidate> stale = findStale(rootPath, maxAgeMs);
        if (!stale.isEmpty()) {
            log.info("Found {} stale test processes", stale.size());
        }
        KillOutcome outcome = terminator.kill(stale, new KillOptions(true, dryRun, killTimeoutMs));
        return new ReclaimReport(stale, outcome);
    }

    private boolean isTestRunner(String command) {
        for (CommandPattern pattern : compiled) {
            if (pattern.matches(command)) {
                return true;
            }
        }
        return false;
    }
}
