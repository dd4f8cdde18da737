package io.parlance.core.execution.pipeline;

import io.parlance.core.execution.ExecutionContext;
import io.parlance.core.execution.ExecutionResult;
import java.util.Optional;

/// One stage of turning a command into a result.
///
/// ### Return Convention
/// - `Optional.empty()`: continue with the next step
/// - `Optional.of(result)`: stop and return this result
///
/// Steps pass data forward by setting it on the {@link ExecutionContext}.
///
/// @see ExecutionPipeline
@FunctionalInterface
public interface ExecutionStep {

    /// Processes one stage.
    ///
    /// @param context the run's context, not null
    /// @return empty to continue, or a final result
    Optional<ExecutionResult> process(ExecutionContext context);
}
