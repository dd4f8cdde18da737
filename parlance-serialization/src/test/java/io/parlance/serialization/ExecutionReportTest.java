package io.parlance.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.ParlanceFactory;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.value.Value;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutionReportTest {

    private static final Instant STARTED = Instant.parse("2024-03-01T10:15:30Z");

    @Test
    void shouldDescribeSuccessfulRun() throws Exception {
        ExecutionResult outcome;
        try (ParlanceEnvironment env =
                ParlanceFactory.builder()
                        .output(new PrintStream(new ByteArrayOutputStream()))
                        .build()) {
            outcome = env.getEngine().run("SAY hi THEN SAY there.");
        }

        ExecutionReport report =
                ExecutionReport.of(
                        "SAY hi THEN SAY there.",
                        outcome,
                        Map.of("who", Value.text("Ada")),
                        STARTED,
                        Duration.ofMillis(1500));
        JsonNode json = ParlanceJson.createMapper().readTree(report.toJson());

        assertThat(json.get("valid").booleanValue()).isTrue();
        assertThat(json.get("verb").textValue()).isEqualTo("SAY TEXT");
        assertThat(json.get("steps").intValue()).isEqualTo(2);
        assertThat(json.get("result").textValue()).isEqualTo("there");
        assertThat(json.get("variables").get("who").textValue()).isEqualTo("Ada");
        assertThat(json.has("failureReason")).isFalse();
        assertThat(json.get("startedAt").textValue()).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(json.get("elapsed").textValue()).isEqualTo("PT1.5S");
    }

    @Test
    void shouldDescribeFailedRun() throws Exception {
        ExecutionReport report =
                ExecutionReport.of(
                        "GET.", ExecutionResult.failed("boom"), Map.of(), STARTED, Duration.ZERO);

        JsonNode json = ParlanceJson.createMapper().readTree(report.toJson());

        assertThat(json.get("valid").booleanValue()).isFalse();
        assertThat(json.get("failureReason").textValue()).isEqualTo("boom");
        assertThat(json.get("steps").intValue()).isZero();
        assertThat(json.has("verb")).isFalse();
        assertThat(json.has("result")).isFalse();
    }
}
