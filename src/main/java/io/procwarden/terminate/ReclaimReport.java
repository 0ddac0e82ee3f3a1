package io.procwarden.terminate;

import io.procwarden.detect.OrphanCandidate;

import java.util.List;

public record ReclaimReport(List<OrphanCandidate> candidates, KillOutcome outcome) {
    public ReclaimReport {
        candidates = List.copyOf(candidates);
    }

    public boolean hasFailures() {
        return outcome.hasFailures();
    }
}
