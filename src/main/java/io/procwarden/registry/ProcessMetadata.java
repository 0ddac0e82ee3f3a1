package io.procwarden.registry;

import java.util.List;

public record ProcessMetadata(
        String command,
        List<String> args,
        String namespace,
        long startTime
) {
    public ProcessMetadata {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        args = args == null ? List.of() : List.copyOf(args);
        namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
    }
}
