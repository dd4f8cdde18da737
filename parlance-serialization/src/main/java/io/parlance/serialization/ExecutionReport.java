package io.parlance.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.value.Value;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// JSON view of one run, as printed by `parlance run --json`.
///
/// @param command the command text, not null
/// @param valid whether the run succeeded
/// @param failureReason reason of a failed run, null on success
/// @param verb identifier of the root implementation, e.g. `GET TEXT`; null on failure
/// @param steps number of steps in the `THEN`-chain, 0 on failure
/// @param result plain form of the result value, null on failure
/// @param variables plain form of the variables after the run, not null
/// @param startedAt when the run started, not null
/// @param elapsed how long the run took, not null
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionReport(
        String command,
        boolean valid,
        String failureReason,
        String verb,
        int steps,
        Object result,
        Map<String, Object> variables,
        Instant startedAt,
        Duration elapsed) {

    public ExecutionReport {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    /// Builds a report from a run's outcome.
    ///
    /// @param command the command text, not null
    /// @param outcome the run's result, not null
    /// @param variables variables visible after the run, not null
    /// @param startedAt when the run started, not null
    /// @param elapsed run duration, not null
    /// @return report, never null
    public static ExecutionReport of(
            String command,
            ExecutionResult outcome,
            Map<String, Value> variables,
            Instant startedAt,
            Duration elapsed) {
        Map<String, Object> plain = new LinkedHashMap<>();
        variables.forEach((name, value) -> plain.put(name, JsonValues.toPlain(value)));
        boolean valid = outcome.isSuccess();
        return new ExecutionReport(
                command,
                valid,
                outcome.failureReason(),
                outcome.sentence() == null ? null : outcome.sentence().root().descriptor().id(),
                outcome.sentence() == null ? 0 : outcome.sentence().steps(),
                JsonValues.toPlain(outcome.result()),
                plain,
                startedAt,
                elapsed);
    }

    /// Writes this report as pretty-printed JSON.
    public String toJson() {
        return ParlanceJson.toJson(this);
    }
}
