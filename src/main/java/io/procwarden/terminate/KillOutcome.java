package io.procwarden.terminate;

import java.util.List;

public record KillOutcome(
        List<Long> killed,
        List<Long> skipped,
        List<KillFailure> failed,
        boolean dryRun
) {
    public KillOutcome {
        killed = List.copyOf(killed);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public static KillOutcome empty(boolean dryRun) {
        return new KillOutcome(List.of(), List.of(), List.of(), dryRun);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public record KillFailure(long pid, String error) {
    }
}
