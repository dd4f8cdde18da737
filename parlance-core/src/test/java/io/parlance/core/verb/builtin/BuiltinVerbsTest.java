package io.parlance.core.verb.builtin;

import static org.assertj.core.api.Assertions.assertThat;

import io.parlance.core.ParlanceConfig;
import io.parlance.core.ParlanceEngine;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.ParlanceFactory;
import io.parlance.core.VariableScope;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.value.Value;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BuiltinVerbsTest {

    @TempDir Path workingDirectory;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private ParlanceEnvironment environment;
    private ParlanceEngine engine;

    @BeforeEach
    void setUp() {
        environment =
                ParlanceFactory.builder()
                        .config(
                                ParlanceConfig.builder()
                                        .workingDirectory(workingDirectory)
                                        .variableScope(VariableScope.SESSION)
                                        .build())
                        .output(new PrintStream(output, true, StandardCharsets.UTF_8))
                        .build();
        engine = environment.getEngine();
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    private Value run(String command) {
        ExecutionResult result = engine.run(command);
        assertThat(result.isSuccess()).as(result.failureReason()).isTrue();
        return result.result();
    }

    private String failure(String command) {
        ExecutionResult result = engine.run(command);
        assertThat(result.isSuccess()).isFalse();
        return result.failureReason();
    }

    @Nested
    class FileHandling {

        @Test
        void shouldSaveTextAndCreateParentDirectories() throws Exception {
            Value result = run("SAVE hello world TO {notes/today.txt}.");

            assertThat(result).isEqualTo(Value.text("hello world"));
            assertThat(Files.readString(workingDirectory.resolve("notes/today.txt")))
                    .isEqualTo("hello world");
        }

        @Test
        void shouldSaveVariableContent() throws Exception {
            engine.registerVariable("body", "from a variable");

            run("SAVE [body] TO {out.txt}.");

            assertThat(Files.readString(workingDirectory.resolve("out.txt")))
                    .isEqualTo("from a variable");
        }

        @Test
        void shouldGetFileAsLines() throws Exception {
            Files.writeString(workingDirectory.resolve("in.txt"), "alpha\nbeta\n");

            Value result = run("GET [lines] FROM {in.txt}.");

            assertThat(result).isEqualTo(Value.lines(List.of("alpha", "beta")));
            assertThat(engine.variables()).containsEntry("lines", result);
        }

        @Test
        void shouldAcceptAbsolutePaths() throws Exception {
            Path file = workingDirectory.resolve("abs.txt");
            Files.writeString(file, "x");

            assertThat(run("GET [lines] FROM {" + file.toAbsolutePath() + "}."))
                    .isEqualTo(Value.lines(List.of("x")));
        }

        @Test
        void shouldReportMissingFileForGet() {
            assertThat(failure("GET [lines] FROM {nope.txt}.")).isEqualTo("File not found: nope.txt");
        }

        @Test
        void shouldReportFullPathOfMissingFileForLoad() {
            assertThat(failure("LOAD [lines] FROM {nope.txt}."))
                    .isEqualTo(
                            "File not found: "
                                    + workingDirectory.resolve("nope.txt").toAbsolutePath().normalize());
        }

        @Test
        void shouldLoadFileAsLines() throws Exception {
            Files.writeString(workingDirectory.resolve("cfg.txt"), "a=1");

            assertThat(run("LOAD [cfg] FROM {cfg.txt}.")).isEqualTo(Value.lines(List.of("a=1")));
        }

        @Test
        @DisplayName("DELETE works with and without FROM")
        void shouldDeleteWithImplicitOrExplicitSource() throws Exception {
            Files.writeString(workingDirectory.resolve("a.txt"), "a");
            Files.writeString(workingDirectory.resolve("b.txt"), "b");

            assertThat(run("DELETE {a.txt}.")).isEqualTo(Value.text("Deleted: a.txt"));
            assertThat(run("DELETE FROM {b.txt}.")).isEqualTo(Value.text("Deleted: b.txt"));
            assertThat(workingDirectory.resolve("a.txt")).doesNotExist();
            assertThat(workingDirectory.resolve("b.txt")).doesNotExist();
        }

        @Test
        void shouldReportMissingFileOnDeleteWithoutFailing() {
            assertThat(run("DELETE {gone.txt}.")).isEqualTo(Value.text("File not found: gone.txt"));
        }

        @Test
        void shouldRefuseToDeleteDirectory() throws Exception {
            Files.createDirectory(workingDirectory.resolve("dir"));

            assertThat(failure("DELETE {dir}.")).isEqualTo("Not a file: dir");
        }

        @Test
        void shouldChainSaveGetAndDelete() {
            Value result =
                    run("SAVE line TO {tmp.txt} THEN GET [copy] FROM {tmp.txt} THEN DELETE {tmp.txt}.");

            assertThat(result).isEqualTo(Value.text("Deleted: tmp.txt"));
            assertThat(engine.variables()).containsEntry("copy", Value.lines(List.of("line")));
        }
    }

    @Nested
    class Output {

        @Test
        void shouldPrintAndReturnMessage() {
            assertThat(run("SAY good morning.")).isEqualTo(Value.text("good morning"));
            assertThat(output.toString(StandardCharsets.UTF_8))
                    .isEqualTo("good morning" + System.lineSeparator());
        }

        @ParameterizedTest
        @ValueSource(strings = {"ECHO", "PRINT", "OUTPUT", "WRITE", "echo"})
        void shouldAcceptSynonyms(String verb) {
            assertThat(run(verb + " hi.")).isEqualTo(Value.text("hi"));
        }

        @Test
        void shouldSimulateEmailDelivery() {
            assertThat(run("SEND report TO {ada@example.com} WITH weekly.").asText())
                    .isEqualTo("Email sent to ada@example.com");
            assertThat(run("SEND report TO {bob@example.com}.").asText())
                    .isEqualTo("Email sent to bob@example.com");
        }
    }

    @Nested
    class Encoding {

        @Test
        void shouldEncodeAsBase64OfCharsetBytes() {
            assertThat(run("TRANSFORM hi USING {UTF-8}.")).isEqualTo(Value.text("aGk="));
        }

        @Test
        void shouldResolveCharsetAliases() {
            assertThat(run("TRANSFORM hi USING unicode.")).isEqualTo(Value.text("aABpAA=="));
            assertThat(run("TRANSFORM hi USING latin1.")).isEqualTo(Value.text("aGk="));
        }

        @Test
        void shouldFailResolutionForUnknownCharset() {
            assertThat(failure("TRANSFORM hi USING {no-such-charset}."))
                    .isEqualTo("Cannot resolve '{no-such-charset}' for USING of TRANSFORM ENCODING");
        }

        @Test
        void shouldRecognizeCharsetsDirectly() {
            assertThat(TransformEncoding.charset("ascii")).contains(StandardCharsets.US_ASCII);
            assertThat(TransformEncoding.charset("utf-16be")).contains(StandardCharsets.UTF_16BE);
            assertThat(TransformEncoding.charset(" ")).isEmpty();
        }
    }
}
