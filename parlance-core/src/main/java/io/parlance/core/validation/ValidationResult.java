package io.parlance.core.validation;

/// Outcome of checking a sentence.
///
/// @param valid whether the sentence may run
/// @param failureReason human-readable reason, null when valid
public record ValidationResult(boolean valid, String failureReason) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    public ValidationResult {
        if (!valid && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("failureReason is required for an invalid result");
        }
        if (valid && failureReason != null) {
            throw new IllegalArgumentException("a valid result carries no failureReason");
        }
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return valid ? "Valid" : "Invalid: " + failureReason;
    }
}
