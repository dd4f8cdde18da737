package io.parlance.core.execution.pipeline;

import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.token.TokenTree;
import io.parlance.core.token.Tokenizer;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Splits the command text into a {@link TokenTree}. Never stops the pipeline.
final class TokenizationStep implements ExecutionStep {

    private static final Logger logger = Logger.getLogger(TokenizationStep.class.getName());

    private final Tokenizer tokenizer;

    TokenizationStep(Tokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
    }

    @Override
    public Optional<ExecutionResult> process(ExecutionContext context) {
        TokenTree tree = TokenTree.of(tokenizer.tokenize(context.getCommand()));
        context.setTokens(tree);
        logger.fine(() -> "Tokens: " + tree.tokens());
        return Optional.empty();
    }
}
