package io.parlance.core;

import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.execution.pipeline.ExecutionPipeline;
import io.parlance.core.value.Value;
import io.parlance.core.variable.VariableTable;
import io.parlance.core.verb.CancellationToken;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for running commands.
///
/// {@link #run(String)} never throws for bad input: every tokenization,
/// validation, dispatch, resolution or verb failure comes back as an
/// {@link ExecutionResult} whose validation is invalid.
///
/// ### Usage
/// {@snippet :
/// try (ParlanceEnvironment env = ParlanceFactory.createEnvironment()) {
///     ExecutionResult result = env.getEngine().run("SAY Hello World.");
///     result.result().asText(); // "Hello World"
/// }
/// }
///
/// @implNote In {@link VariableScope#PER_RUN} scope concurrent runs are independent.
/// In {@link VariableScope#SESSION} scope the shared table is **not thread-safe**;
/// callers serialize runs.
public final class ParlanceEngine {

    private static final Logger logger = Logger.getLogger(ParlanceEngine.class.getName());

    private final ExecutionPipeline pipeline;
    private final ExecutionPipeline validationPipeline;
    private final VariableTable variables;
    private final VariableScope scope;

    /// Creates an engine.
    ///
    /// @param pipeline full pipeline used by {@link #run(String)}, not null
    /// @param validationPipeline pipeline without execution used by {@link #validate(String)}, not null
    /// @param variables engine-level variables, not null
    /// @param scope variable lifetime, not null
    public ParlanceEngine(
            ExecutionPipeline pipeline,
            ExecutionPipeline validationPipeline,
            VariableTable variables,
            VariableScope scope) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.validationPipeline =
                Objects.requireNonNull(validationPipeline, "validationPipeline must not be null");
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /// Runs a command and its `THEN`-chain to completion.
    ///
    /// @param command command text, not null
    /// @return outcome, never null
    public ExecutionResult run(String command) {
        return run(command, CancellationToken.NONE);
    }

    /// Runs a command, handing a cancellation token to every verb.
    ///
    /// The engine does not interpret the token; verbs decide how to honor it.
    ///
    /// @param command command text, not null
    /// @param cancellation caller's token, not null
    /// @return outcome, never null
    public ExecutionResult run(String command, CancellationToken cancellation) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        VariableTable table = scope == VariableScope.SESSION ? variables : variables.copy();
        ExecutionResult result =
                pipeline.execute(new ExecutionContext(command, table, cancellation));
        if (result.isSuccess()) {
            logger.fine(() -> "Ran '" + command + "'");
        } else {
            logger.fine(() -> "Rejected '" + command + "': " + result.failureReason());
        }
        return result;
    }

    /// Tokenizes, validates and dispatches a command without running it.
    ///
    /// @param command command text, not null
    /// @return outcome with the dispatched sentence and no value, never null
    public ExecutionResult validate(String command) {
        Objects.requireNonNull(command, "command must not be null");
        return validationPipeline.execute(
                new ExecutionContext(command, variables.copy(), CancellationToken.NONE));
    }

    /// Registers an engine-level variable, visible to every later run.
    ///
    /// @param name variable name without brackets, not null
    /// @param value value, not null
    public void registerVariable(String name, Object value) {
        variables.register(name, value);
    }

    /// Returns the engine-level variables.
    ///
    /// @return snapshot keyed by display name, never null
    public Map<String, Value> variables() {
        return variables.snapshot();
    }

    /// Removes all engine-level variables.
    public void clearVariables() {
        variables.clear();
    }

    public VariableScope scope() {
        return scope;
    }
}
