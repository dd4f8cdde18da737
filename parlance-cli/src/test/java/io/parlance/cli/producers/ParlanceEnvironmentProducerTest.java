package io.parlance.cli.producers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.parlance.core.ParlanceConfig;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.VariableScope;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ParlanceEnvironmentProducerTest {

    @TempDir Path tempDir;

    @Mock private Config config;

    private ParlanceEnvironmentProducer producer;

    @BeforeEach
    void setUp() {
        producer = new ParlanceEnvironmentProducer();
        producer.config = config;
    }

    @Test
    void shouldMapPropertiesOntoConfig() {
        when(config.getOptionalValue("parlance.working.dir", String.class))
                .thenReturn(Optional.of(tempDir.toString()));
        when(config.getOptionalValue("parlance.variables.scope", String.class))
                .thenReturn(Optional.of(" session "));
        when(config.getOptionalValue("parlance.matchers.regex", Boolean.class))
                .thenReturn(Optional.of(true));
        when(config.getOptionalValue("parlance.http.timeout", String.class))
                .thenReturn(Optional.of("PT30S"));
        when(config.getOptionalValue("parlance.http.threads", Integer.class))
                .thenReturn(Optional.of(2));

        ParlanceConfig result = producer.createConfig();

        assertThat(result.getWorkingDirectory()).isEqualTo(tempDir);
        assertThat(result.getVariableScope()).isEqualTo(VariableScope.SESSION);
        assertThat(result.isUseRegexMatchers()).isTrue();
        assertThat(result.getHttpTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(result.getHttpThreadPoolSize()).isEqualTo(2);
    }

    @Test
    void shouldKeepDefaultsForMissingProperties() {
        ParlanceConfig result = producer.createConfig();

        assertThat(result.getWorkingDirectory()).isEqualTo(Path.of("."));
        assertThat(result.getVariableScope()).isEqualTo(VariableScope.PER_RUN);
        assertThat(result.getHttpThreadPoolSize()).isEqualTo(4);
    }

    @Test
    void shouldRejectUnknownScope() {
        when(config.getOptionalValue("parlance.variables.scope", String.class))
                .thenReturn(Optional.of("forever"));

        assertThatThrownBy(() -> producer.createConfig())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldProduceEnvironmentWithJsonVerbs() {
        when(config.getOptionalValue("parlance.working.dir", String.class))
                .thenReturn(Optional.of(tempDir.toString()));

        ParlanceEnvironment environment = producer.parlanceEnvironment();
        try {
            assertThat(environment.getVerbRegistry().size()).isEqualTo(10);
            assertThat(environment.getLexicon().usageNames("LOAD")).contains("Config", "Text");
            assertThat(environment.getConfig().getWorkingDirectory()).isEqualTo(tempDir);
        } finally {
            producer.cleanup();
        }
    }
}
