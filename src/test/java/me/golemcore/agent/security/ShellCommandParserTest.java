package me.golemcore.agent.security;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellCommandParserTest {

    @Test
    void shouldReturnRootsOfChainedCommands() {
        assertEquals(List.of("git", "echo"),
                ShellCommandParser.getCommandRoots("git commit -m \"feat: x\" && echo done"));
    }

    @Test
    void shouldStripPathFromCommandRoot() {
        assertEquals("git", ShellCommandParser.getCommandRoot("/usr/bin/git status"));
        assertEquals("python", ShellCommandParser.getCommandRoot("\"C:\\Program Files\\python\" -V"));
        assertNull(ShellCommandParser.getCommandRoot("   "));
    }

    @Test
    void shouldSplitOnEveryOperatorOutsideQuotes() {
        assertEquals(List.of("a", "b", "c", "d", "e"),
                ShellCommandParser.splitCommands("a && b || c ; d | e"));
        assertEquals(List.of("echo 'a && b'", "ls"),
                ShellCommandParser.splitCommands("echo 'a && b' && ls"));
        assertEquals(List.of("echo \"x;y\""), ShellCommandParser.splitCommands("echo \"x;y\""));
    }

    @Test
    void shouldKeepEscapedOperatorsInSegment() {
        assertEquals(List.of("echo a \\; b"), ShellCommandParser.splitCommands("echo a \\; b"));
    }

    @Test
    void shouldDropEmptySegments() {
        assertEquals(List.of("ls"), ShellCommandParser.splitCommands(";; ls ;"));
    }

    @Test
    void shouldStripShellWrapperAndQuotes() {
        assertEquals("ls -la", ShellCommandParser.stripShellWrapper("bash -c 'ls -la'"));
        assertEquals("dir", ShellCommandParser.stripShellWrapper("cmd.exe /c \"dir\""));
        assertEquals("echo hi", ShellCommandParser.stripShellWrapper("  echo hi  "));
        assertEquals(List.of("rm"), ShellCommandParser.getCommandRoots("sh -c \"rm -rf tmp\""));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "echo $(whoami)",
            "echo `whoami`",
            "diff <(ls a) <(ls b)",
            "tee >(cat)",
            "echo \"$(date)\"",
            "echo \"`date`\"",
            "ls && cat $(find . -name x)"
    })
    void shouldDetectSubstitution(String command) {
        assertTrue(ShellCommandParser.detectCommandSubstitution(command));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "echo '$(whoami)'",
            "echo '`whoami`'",
            "echo '<(ls)'",
            "echo \\$(whoami)",
            "echo \"<(not a process)\"",
            "echo $HOME",
            "ls -la > out.txt"
    })
    void shouldNotDetectQuotedOrEscapedSubstitution(String command) {
        assertFalse(ShellCommandParser.detectCommandSubstitution(command));
    }

    @Test
    void shouldSplitArgumentsHonouringQuotes() {
        assertEquals(List.of("npx", "-y", "@scope/server", "--root", "/tmp/my dir"),
                ShellCommandParser.splitArguments("npx -y @scope/server --root \"/tmp/my dir\""));
        assertEquals(List.of("echo", "a b", ""), ShellCommandParser.splitArguments("echo a\\ b ''"));
    }

    @Test
    void shouldRewriteFirstWordToRoot() {
        assertEquals("git status", ShellCommandParser.withCommandRoot("/usr/bin/git status"));
        assertEquals("ls", ShellCommandParser.withCommandRoot("ls"));
    }
}
