package io.parlance.core.execution.pipeline;

import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.validation.SentenceValidator;
import io.parlance.core.validation.ValidationResult;
import io.parlance.core.word.WordChain;
import io.parlance.core.word.WordFactory;
import java.util.Objects;
import java.util.Optional;

/// Builds the word chain of the whole command and checks its grammar.
final class ValidationStep implements ExecutionStep {

    private final WordFactory wordFactory;
    private final SentenceValidator validator;

    ValidationStep(WordFactory wordFactory, SentenceValidator validator) {
        this.wordFactory = Objects.requireNonNull(wordFactory, "wordFactory must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    @Override
    public Optional<ExecutionResult> process(ExecutionContext context) {
        WordChain words = wordFactory.create(context.getTokens());
        context.setWords(words);
        ValidationResult validation = validator.validate(words);
        context.setValidation(validation);
        return validation.valid()
                ? Optional.empty()
                : Optional.of(ExecutionResult.invalid(validation));
    }
}
