package io.parlance.core.execution.pipeline;

import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.sentence.SentenceExecutor;
import io.parlance.core.sentence.SentenceFactory;
import io.parlance.core.token.Tokenizer;
import io.parlance.core.validation.SentenceValidator;
import io.parlance.core.word.WordFactory;
import java.util.List;
import java.util.Optional;

/// Runs {@link ExecutionStep}s in order, stopping at the first one that returns a result.
///
/// ### Contracts
/// - **Postcondition**: {@link #execute(ExecutionContext)} never returns null
/// - **Invariant**: steps run in list order; none is skipped unless an earlier one stops
///
/// @implNote Stateless and thread-safe. Step list is copied at construction time.
public final class ExecutionPipeline {

    private final List<ExecutionStep> steps;

    /// Creates a pipeline with the given steps.
    ///
    /// @param steps ordered steps, not null
    public ExecutionPipeline(List<ExecutionStep> steps) {
        this.steps = List.copyOf(steps);
    }

    /// Builds the full pipeline:
    /// 1. Tokenization: text to token tree
    /// 2. Validation: word chain and grammar check
    /// 3. Sentence creation: dispatch of every `THEN` segment
    /// 4. Sentence execution: run, store results, produce the final value
    ///
    /// @return configured pipeline, never null
    public static ExecutionPipeline standard(
            Tokenizer tokenizer,
            WordFactory wordFactory,
            SentenceValidator validator,
            SentenceFactory sentenceFactory,
            SentenceExecutor executor) {
        return new ExecutionPipeline(
                List.of(
                        new TokenizationStep(tokenizer),
                        new ValidationStep(wordFactory, validator),
                        new SentenceCreationStep(sentenceFactory),
                        new SentenceExecutionStep(executor)));
    }

    /// Builds the pipeline without the execution step. Its result carries the
    /// dispatched sentence and no value.
    ///
    /// @return configured pipeline, never null
    public static ExecutionPipeline validationOnly(
            Tokenizer tokenizer,
            WordFactory wordFactory,
            SentenceValidator validator,
            SentenceFactory sentenceFactory) {
        return new ExecutionPipeline(
                List.of(
                        new TokenizationStep(tokenizer),
                        new ValidationStep(wordFactory, validator),
                        new SentenceCreationStep(sentenceFactory)));
    }

    /// Runs all steps.
    ///
    /// @param context the run's context, not null
    /// @return the first step result, or the validated sentence if no step stopped
    public ExecutionResult execute(ExecutionContext context) {
        for (var step : steps) {
            Optional<ExecutionResult> result = step.process(context);
            if (result.isPresent()) {
                return result.get();
            }
        }
        if (context.getSentence() != null) {
            return ExecutionResult.validated(context.getSentence());
        }
        return ExecutionResult.failed("Sentence was not processed");
    }
}
