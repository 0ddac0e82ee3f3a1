package io.procwarden.os;

public final class ProcessSignalException extends Exception {
    public enum Reason {
        NO_SUCH_PROCESS,
        PERMISSION_DENIED,
        OS_ERROR
    }

    private final long pid;
    private final Reason reason;

    public ProcessSignalException(long pid, Reason reason, String message) {
        super(message);
        this.pid = pid;
        this.reason = reason;
    }

    public ProcessSignalException(long pid, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.pid = pid;
        this.reason = reason;
    }

    public long pid() {
        return pid;
    }

    public Reason reason() {
        return reason;
    }
}
