package io.parlance.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.parlance.core.verb.DefaultVerbRegistry;
import io.parlance.core.verb.TestVerb;
import io.parlance.core.verb.VerbModule;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParlanceFactoryTest {

    @TempDir Path workingDirectory;

    @Test
    void shouldRegisterBuiltinVerbsByDefault() {
        try (ParlanceEnvironment env = ParlanceFactory.createEnvironment()) {
            assertThat(env.getVerbRegistry().size()).isEqualTo(9);
            assertThat(env.getLexicon().families()).contains("SAY", "TRANSFORM");
            assertThat(env.getEngine().scope()).isEqualTo(VariableScope.PER_RUN);
        }
    }

    @Test
    void shouldFailWithoutAnyVerb() {
        assertThatThrownBy(() -> ParlanceFactory.builder().includeBuiltinVerbs(false).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No verbs registered; the interpreter cannot run");
    }

    @Test
    void shouldRegisterExtraVerbsIntoSuppliedRegistry() {
        DefaultVerbRegistry registry = new DefaultVerbRegistry();
        VerbModule pong = r -> r.register(TestVerb.builder("PONG", "Host").supplier());

        try (ParlanceEnvironment env =
                ParlanceFactory.builder()
                        .includeBuiltinVerbs(false)
                        .verbRegistry(registry)
                        .verb(TestVerb.builder("PING", "Host").supplier())
                        .verbModules(List.of(pong))
                        .build()) {
            assertThat(env.getVerbRegistry()).isSameAs(registry);
            assertThat(registry.size()).isEqualTo(2);
            assertThat(env.getEngine().run("PING home.").isSuccess()).isTrue();
        }
    }

    @Test
    void shouldApplyConfiguration() {
        ParlanceConfig config =
                ParlanceConfig.builder()
                        .workingDirectory(workingDirectory)
                        .variableScope(VariableScope.SESSION)
                        .useRegexMatchers(true)
                        .httpTimeout(Duration.ofSeconds(3))
                        .httpThreadPoolSize(2)
                        .build();

        try (ParlanceEnvironment env = ParlanceFactory.createEnvironment(config)) {
            assertThat(env.getConfig()).isSameAs(config);
            assertThat(env.getEngine().scope()).isEqualTo(VariableScope.SESSION);
            assertThat(env.getVerbServices().workingDirectory()).isEqualTo(workingDirectory);
            assertThat(env.getVerbServices().httpTimeout()).isEqualTo(Duration.ofSeconds(3));
        }
    }

    @Test
    void shouldUseDocumentedDefaults() {
        ParlanceConfig config = new ParlanceConfig();

        assertThat(config.getWorkingDirectory()).isEqualTo(Path.of("."));
        assertThat(config.getVariableScope()).isEqualTo(VariableScope.PER_RUN);
        assertThat(config.isUseRegexMatchers()).isFalse();
        assertThat(config.getHttpTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getHttpThreadPoolSize()).isEqualTo(4);
    }
}
