package io.parlance.core.execution.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.parlance.core.TestInterpreter;
import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.validation.ValidationResult;
import io.parlance.core.value.Value;
import io.parlance.core.variable.VariableTable;
import io.parlance.core.verb.CancellationToken;
import io.parlance.core.verb.TestVerb;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionPipelineTest {

    private TestInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new TestInterpreter().with(TestVerb.builder("SAY", "Text").supplier());
    }

    private ExecutionContext context(String command) {
        return new ExecutionContext(
                command, new VariableTable(interpreter.matcher), CancellationToken.NONE);
    }

    @Nested
    class StepOrdering {

        @Test
        void shouldStopAtFirstStepReturningResult() {
            List<String> visited = new ArrayList<>();
            ExecutionPipeline pipeline =
                    new ExecutionPipeline(
                            List.of(
                                    ctx -> {
                                        visited.add("first");
                                        return Optional.empty();
                                    },
                                    ctx -> {
                                        visited.add("second");
                                        return Optional.of(ExecutionResult.failed("stopped"));
                                    },
                                    ctx -> {
                                        visited.add("third");
                                        return Optional.empty();
                                    }));

            ExecutionResult result = pipeline.execute(context("SAY hi."));

            assertThat(visited).containsExactly("first", "second");
            assertThat(result.failureReason()).isEqualTo("stopped");
        }

        @Test
        void shouldFailWhenNoStepProducedSentence() {
            ExecutionPipeline pipeline = new ExecutionPipeline(List.of(ctx -> Optional.empty()));

            ExecutionResult result = pipeline.execute(context("SAY hi."));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.failureReason()).isEqualTo("Sentence was not processed");
        }

        @Test
        void shouldCopyStepList() {
            List<ExecutionStep> steps = new ArrayList<>();
            ExecutionPipeline pipeline = new ExecutionPipeline(steps);
            steps.add(ctx -> Optional.of(ExecutionResult.failed("late")));

            assertThat(pipeline.execute(context("SAY hi.")).failureReason())
                    .isEqualTo("Sentence was not processed");
        }
    }

    @Nested
    class ValidationOnly {

        private ExecutionPipeline pipeline;

        @BeforeEach
        void setUp() {
            pipeline =
                    ExecutionPipeline.validationOnly(
                            interpreter.tokenizer,
                            interpreter.wordFactory,
                            interpreter.validator,
                            interpreter.sentenceFactory);
        }

        @Test
        void shouldReturnDispatchedSentenceWithoutValue() {
            ExecutionContext context = context("SAY hi THEN SAY bye.");

            ExecutionResult result = pipeline.execute(context);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.result()).isNull();
            assertThat(result.sentence().steps()).isEqualTo(2);
            assertThat(context.getTokens()).isNotNull();
            assertThat(context.getWords()).isNotNull();
        }

        @Test
        void shouldStopBeforeDispatchWhenInvalid() {
            ExecutionContext context = context("hello there.");

            ExecutionResult result = pipeline.execute(context);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.sentence()).isNull();
            assertThat(context.getValidation().valid()).isFalse();
            assertThat(context.getSentence()).isNull();
        }
    }

    @Test
    void shouldRejectInvalidResultCarryingValue() {
        assertThatThrownBy(
                        () ->
                                new ExecutionResult(
                                        ValidationResult.failure("bad"), null, Value.text("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
