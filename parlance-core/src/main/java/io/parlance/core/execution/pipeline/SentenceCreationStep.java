package io.parlance.core.execution.pipeline;

import io.parlance.core.exception.DispatchException;
import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.sentence.SentenceFactory;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Dispatches every segment of the validated command.
final class SentenceCreationStep implements ExecutionStep {

    private static final Logger logger = Logger.getLogger(SentenceCreationStep.class.getName());

    private final SentenceFactory sentenceFactory;

    SentenceCreationStep(SentenceFactory sentenceFactory) {
        this.sentenceFactory =
                Objects.requireNonNull(sentenceFactory, "sentenceFactory must not be null");
    }

    @Override
    public Optional<ExecutionResult> process(ExecutionContext context) {
        try {
            context.setSentence(sentenceFactory.create(context.getTokens()));
            return Optional.empty();
        } catch (DispatchException e) {
            logger.fine(() -> "Dispatch failed for '" + context.getCommand() + "': " + e.getMessage());
            return Optional.of(ExecutionResult.failed(e.getMessage()));
        }
    }
}
