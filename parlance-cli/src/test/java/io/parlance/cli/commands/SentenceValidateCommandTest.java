package io.parlance.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.parlance.core.VariableScope;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SentenceValidateCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private SentenceValidateCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new SentenceValidateCommand();
        injectField(command, "environment", createEnvironment(tempDir, VariableScope.PER_RUN));
    }

    @Test
    void shouldListStepsWithoutRunningThem() throws Exception {
        // Given
        injectField(command, "words", List.of("SAVE draft TO {out.txt} THEN SAY done."));

        // When
        command.run();

        // Then
        String output = out();
        assertThat(output).contains(" [OK] Sentence is valid!");
        assertThat(output).contains("Verb: SAVE TEXT");
        assertThat(output).contains("Steps: 2");
        assertThat(output).contains("1. SAVE TEXT");
        assertThat(output).contains("2. → SAY TEXT");
        assertThat(output).doesNotContain(System.lineSeparator() + "done" + System.lineSeparator());
        assertThat(tempDir.resolve("out.txt")).doesNotExist();
    }

    @Test
    void shouldReportInvalidSentence() throws Exception {
        injectField(command, "words", List.of("hello", "world."));

        command.run();

        assertThat(err()).contains(" [FAIL] Validation failed:");
        assertThat(out()).doesNotContain("Sentence is valid");
    }

    @Test
    void shouldReportDispatchFailure() throws Exception {
        injectField(command, "words", List.of("TRANSFORM", "hi."));

        command.run();

        assertThat(err()).contains(" [FAIL] Validation failed:");
    }
}
