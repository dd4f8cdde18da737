package io.parlance.cli.shell;

import static org.assertj.core.api.Assertions.assertThat;

import io.parlance.cli.ui.AnsiStyles;
import io.parlance.core.ParlanceConfig;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.ParlanceFactory;
import io.parlance.core.VariableScope;
import io.parlance.core.value.Value;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Scanner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShellSessionTest {

    @TempDir Path tempDir;

    private ParlanceEnvironment environment;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        environment =
                ParlanceFactory.builder()
                        .config(
                                ParlanceConfig.builder()
                                        .workingDirectory(tempDir)
                                        .variableScope(VariableScope.SESSION)
                                        .build())
                        .output(new PrintStream(new ByteArrayOutputStream()))
                        .build();
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    private ShellSession session(String input) {
        return new ShellSession(
                new Scanner(input),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                environment,
                AnsiStyles.of(false));
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Nested
    class Loop {

        @Test
        void shouldRunSentencesUntilExit() {
            ShellSession session = session("SAY hi.\nexit\nSAY never.\n");

            session.run();

            assertThat(output()).contains("parlance> ");
            assertThat(output()).contains("✓ hi");
            assertThat(output()).doesNotContain("never");
            assertThat(output()).endsWith("Bye." + System.lineSeparator());
            assertThat(session.history()).containsExactly("SAY hi.");
        }

        @Test
        void shouldEndAtEndOfInput() {
            ShellSession session = session("SAY one.\n");

            session.run();

            assertThat(output()).contains("✓ one").contains("Bye.");
        }

        @Test
        void shouldShowFailureReason() {
            session("SAY [nobody].\nquit\n").run();

            assertThat(output()).contains("✗ Variable [nobody] not found");
        }
    }

    @Nested
    class Commands {

        @Test
        void shouldAssignAndListVariables() {
            ShellSession session = session("");

            session.handle("set [greeting] hello world");
            session.handle("vars");

            assertThat(environment.getEngine().variables())
                    .containsEntry("greeting", Value.text("hello world"));
            assertThat(output()).contains("[greeting] = hello world");
            assertThat(output()).contains("[greeting] (Text) = hello world");
        }

        @Test
        void shouldUseAssignedVariableInSentence() {
            ShellSession session = session("");

            session.handle("set name Ada");
            session.handle("SAY hello [name].");

            assertThat(output()).contains("✓ hello Ada");
        }

        @Test
        void shouldExplainSetUsage() {
            session("").handle("set lonely");

            assertThat(output()).contains("Usage: set <name> <value>");
        }

        @Test
        void shouldClearVariables() {
            ShellSession session = session("");
            session.handle("set a 1");

            session.handle("clear");
            session.handle("vars");

            assertThat(output()).contains("Variables cleared.").contains("No variables.");
        }

        @Test
        void shouldNumberHistory() {
            ShellSession session = session("");
            session.handle("SAY one.");
            session.handle("SAY two.");

            session.handle("history");

            assertThat(output()).contains("  1  SAY one.").contains("  2  SAY two.");
        }

        @Test
        void shouldTreatTerminatedLineAsSentence() {
            ShellSession session = session("");

            assertThat(session.handle("exit.")).isTrue();
            assertThat(session.history()).containsExactly("exit.");
            assertThat(session.handle("EXIT")).isFalse();
        }

        @Test
        void shouldListVerbsAndHelp() {
            ShellSession session = session("");

            session.handle("verbs");
            session.handle("help");

            assertThat(output()).contains("TRANSFORM").contains("Shell commands:");
        }

        @Test
        void shouldIgnoreBlankLines() {
            ShellSession session = session("");

            assertThat(session.handle("   ")).isTrue();
            assertThat(session.history()).isEmpty();
            assertThat(output()).isEmpty();
        }
    }
}
