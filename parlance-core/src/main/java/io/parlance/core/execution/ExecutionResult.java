package io.parlance.core.execution;

import io.parlance.core.sentence.Sentence;
import io.parlance.core.validation.ValidationResult;
import io.parlance.core.value.Value;
import java.util.Objects;

/// What a run produced: the validation outcome, the sentence and its result.
///
/// ### Contracts
/// - **Invariant**: an invalid validation carries neither a sentence nor a result
///
/// @param validation validation outcome, not null
/// @param sentence dispatched sentence, null when invalid or not yet built
/// @param result value of the last step, null when invalid or not executed
public record ExecutionResult(ValidationResult validation, Sentence sentence, Value result) {

    public ExecutionResult {
        Objects.requireNonNull(validation, "validation must not be null");
        if (!validation.valid() && (sentence != null || result != null)) {
            throw new IllegalArgumentException("an invalid result carries no sentence or value");
        }
    }

    /// A sentence that ran to completion.
    public static ExecutionResult success(Sentence sentence, Value result) {
        return new ExecutionResult(ValidationResult.success(), sentence, result);
    }

    /// A sentence that passed validation and dispatch but was not executed.
    public static ExecutionResult validated(Sentence sentence) {
        return new ExecutionResult(ValidationResult.success(), sentence, null);
    }

    /// Wraps a failed validation.
    public static ExecutionResult invalid(ValidationResult validation) {
        return new ExecutionResult(validation, null, null);
    }

    /// A failure found at any stage, described by a message.
    public static ExecutionResult failed(String reason) {
        return invalid(ValidationResult.failure(reason));
    }

    public boolean isSuccess() {
        return validation.valid();
    }

    /// Returns the failure reason, or null on success.
    public String failureReason() {
        return validation.failureReason();
    }
}
