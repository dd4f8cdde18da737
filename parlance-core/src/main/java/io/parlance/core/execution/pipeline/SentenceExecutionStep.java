package io.parlance.core.execution.pipeline;

import io.parlance.core.exception.ResolutionException;
import io.parlance.core.exception.StructuredValueException;
import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.sentence.SentenceExecutor;
import io.parlance.core.value.Value;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Runs the dispatched sentence. Always ends the pipeline.
final class SentenceExecutionStep implements ExecutionStep {

    private static final Logger logger = Logger.getLogger(SentenceExecutionStep.class.getName());

    private final SentenceExecutor executor;

    SentenceExecutionStep(SentenceExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public Optional<ExecutionResult> process(ExecutionContext context) {
        try {
            Value result =
                    executor.execute(
                            context.getSentence(),
                            context.getVariables(),
                            context.getCancellation());
            return Optional.of(ExecutionResult.success(context.getSentence(), result));
        } catch (ResolutionException | VerbExecutionException | StructuredValueException e) {
            logger.warning("Run of '" + context.getCommand() + "' failed: " + e.getMessage());
            return Optional.of(ExecutionResult.failed(e.getMessage()));
        }
    }
}
