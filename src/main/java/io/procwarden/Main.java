package io.procwarden;

import io.procwarden.cli.WardenCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new WardenCommand()).execute(args);
        System.exit(code);
    }
}
