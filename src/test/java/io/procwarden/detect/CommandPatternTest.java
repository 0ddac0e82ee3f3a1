package io.procwarden.detect;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class CommandPatternTest {

    @Test
    void plainPatternsMatchAsSubstrings() {
        CommandPattern pattern = CommandPattern.compile("bun test");
        Assertions.assertTrue(pattern.matches("/usr/local/bin/bun test src/a.test.ts"));
        Assertions.assertFalse(pattern.matches("bun run build"));
        Assertions.assertFalse(pattern.matches(""));
        // Regex metacharacters are literal without ".*".
        Assertions.assertTrue(CommandPattern.compile("a+b").matches("x a+b y"));
        Assertions.assertFalse(CommandPattern.compile("a+b").matches("aab"));
    }

    @Test
    void patternsWithWildcardAreRegularExpressions() {
        CommandPattern pattern = CommandPattern.compile("zsh -c -l source.*shell-snapshots");
        Assertions.assertTrue(pattern.matches("/bin/zsh -c -l source /home/dev/.claude/shell-snapshots/snapshot-zsh.sh"));
        Assertions.assertFalse(pattern.matches("/bin/zsh -c -l echo hi"));
    }

    @Test
    void invalidOrEmptyPatternsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CommandPattern.compile(" "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CommandPattern.compile("(.*"));
        Assertions.assertEquals(1, CommandPattern.compileAll(List.of("claude", "", " ")).size());
    }
}
