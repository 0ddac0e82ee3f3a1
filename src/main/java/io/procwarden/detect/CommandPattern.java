package io.procwarden.detect;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class CommandPattern {
    private final String source;
    private final Pattern regex;

    private CommandPattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    public static CommandPattern compile(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("pattern cannot be empty");
        }
        if (!source.contains(".*")) {
            return new CommandPattern(source, null);
        }
        try {
            return new CommandPattern(source, Pattern.compile(source));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid pattern: " + source, e);
        }
    }

    public static List<CommandPattern> compileAll(List<String> sources) {
        List<CommandPattern> out = new ArrayList<>();
        for (String source : sources) {
            if (source != null && !source.isBlank()) {
                out.add(compile(source));
            }
        }
        return out;
    }

    public boolean matches(String command) {
        if (command == null || command.isEmpty()) {
            return false;
        }
        return regex == null ? command.contains(source) : regex.matcher(command).find();
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
