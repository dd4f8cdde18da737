package io.parlance.core.execution;

import io.parlance.core.sentence.Sentence;
import io.parlance.core.token.TokenTree;
import io.parlance.core.validation.ValidationResult;
import io.parlance.core.variable.VariableResolver;
import io.parlance.core.verb.CancellationToken;
import io.parlance.core.word.WordChain;
import java.util.Objects;

/// Mutable state of one run, filled in by the pipeline steps in order.
///
/// @implNote **Not thread-safe**. One context per run.
public final class ExecutionContext {

    private final String command;
    private final VariableResolver variables;
    private final CancellationToken cancellation;

    private TokenTree tokens;
    private WordChain words;
    private ValidationResult validation;
    private Sentence sentence;

    /// Creates the context of one run.
    ///
    /// @param command raw command text, not null
    /// @param variables table owned by this run, not null
    /// @param cancellation caller's token, passed to verbs untouched, not null
    public ExecutionContext(
            String command, VariableResolver variables, CancellationToken cancellation) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    public String getCommand() {
        return command;
    }

    public VariableResolver getVariables() {
        return variables;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    public TokenTree getTokens() {
        return tokens;
    }

    public void setTokens(TokenTree tokens) {
        this.tokens = tokens;
    }

    public WordChain getWords() {
        return words;
    }

    public void setWords(WordChain words) {
        this.words = words;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    public void setValidation(ValidationResult validation) {
        this.validation = validation;
    }

    public Sentence getSentence() {
        return sentence;
    }

    public void setSentence(Sentence sentence) {
        this.sentence = sentence;
    }
}
