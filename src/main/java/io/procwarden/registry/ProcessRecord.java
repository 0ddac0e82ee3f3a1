package io.procwarden.registry;

import java.util.List;

public record ProcessRecord(
        long pid,
        String command,
        List<String> args,
        String namespace,
        long startTime,
        ProcessStatus status,
        long ownerPid
) {
    public ProcessRecord {
        args = args == null ? List.of() : List.copyOf(args);
        status = status == null ? ProcessStatus.RUNNING : status;
    }

    public static ProcessRecord running(long pid, ProcessMetadata metadata, long ownerPid) {
        return new ProcessRecord(
                pid,
                metadata.command(),
                metadata.args(),
                metadata.namespace(),
                metadata.startTime(),
                ProcessStatus.RUNNING,
                ownerPid
        );
    }

    public ProcessRecord withStatus(ProcessStatus next) {
        return new ProcessRecord(pid, command, args, namespace, startTime, next, ownerPid);
    }

    public String commandLine() {
        if (args.isEmpty()) {
            return command;
        }
        return command + " " + String.join(" ", args);
    }
}
