package io.procwarden.os;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class ProcessTables {
    private ProcessTables() {
    }

    public static ProcessTable forCurrentPlatform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("linux") && Files.isDirectory(Path.of("/proc/self"))) {
            return new LinuxProcessTable();
        }
        if (os.contains("mac") || os.contains("darwin") || os.contains("bsd")) {
            return new PsProcessTable();
        }
        return new ProcessHandleTable();
    }
}
