package io.procwarden.terminate;

public record TerminationResult(long pid, Status status, String error) {
    public enum Status {
        KILLED,
        SKIPPED,
        FAILED
    }

    static TerminationResult killed(long pid) {
        return new TerminationResult(pid, Status.KILLED, null);
    }

    static TerminationResult skipped(long pid) {
        return new TerminationResult(pid, Status.SKIPPED, null);
    }

    static TerminationResult failed(long pid, String error) {
        return new TerminationResult(pid, Status.FAILED, error);
    }

    public boolean isKilled() {
        return status == Status.KILLED;
    }
}
