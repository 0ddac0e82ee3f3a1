package io.procwarden.os;

public enum Signal {
    TERM("SIGTERM"),
    KILL("SIGKILL");

    private final String label;

    Signal(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
