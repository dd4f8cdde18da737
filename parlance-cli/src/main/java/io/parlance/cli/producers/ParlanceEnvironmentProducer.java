package io.parlance.cli.producers;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.parlance.core.ParlanceConfig;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.ParlanceFactory;
import io.parlance.core.VariableScope;
import io.parlance.serialization.JacksonStructuredValueReader;
import io.parlance.serialization.ParlanceJson;
import io.parlance.serialization.verb.JsonVerbs;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the Parlance runtime environment.
///
/// Builds one environment with the built-in verbs plus the JSON verbs, and a Jackson
/// reader for destructuring.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `parlance.working.dir` | Path | `.` | Base for relative file paths |
/// | `parlance.variables.scope` | `PER_RUN` / `SESSION` | `PER_RUN` | Variable lifetime |
/// | `parlance.matchers.regex` | Boolean | `false` | Use the regex token matchers |
/// | `parlance.http.timeout` | Duration | `PT5M` | Timeout of network verbs |
/// | `parlance.http.threads` | Integer | `4` | Threads behind the HTTP client |
///
/// @implNote Application-scoped. The environment is produced as a `@Singleton`
/// because {@link ParlanceEnvironment} is final and cannot be proxied.
@ApplicationScoped
public class ParlanceEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(ParlanceEnvironmentProducer.class.getName());

    private ParlanceEnvironment parlanceEnvironment;

    @Inject Config config;

    /// Produces the Parlance runtime environment for CDI injection.
    ///
    /// @return configured environment, never null
    @Produces
    @Singleton
    public ParlanceEnvironment parlanceEnvironment() {
        ObjectMapper mapper = ParlanceJson.createMapper();

        parlanceEnvironment =
                ParlanceFactory.builder()
                        .config(createConfig())
                        .verbModule(new JsonVerbs(mapper))
                        .structuredValueReader(new JacksonStructuredValueReader(mapper))
                        .build();

        logger.info(
                "Configured ParlanceEnvironment with "
                        + parlanceEnvironment.getVerbRegistry().size()
                        + " verbs in "
                        + parlanceEnvironment.getConfig().getWorkingDirectory());
        return parlanceEnvironment;
    }

    /// Maps `parlance.*` properties onto a {@link ParlanceConfig}.
    ParlanceConfig createConfig() {
        ParlanceConfig.Builder builder = ParlanceConfig.builder();

        config.getOptionalValue("parlance.working.dir", String.class)
                .filter(dir -> !dir.isBlank())
                .ifPresent(dir -> builder.workingDirectory(Path.of(dir)));
        config.getOptionalValue("parlance.variables.scope", String.class)
                .map(scope -> VariableScope.valueOf(scope.strip().toUpperCase(Locale.ROOT)))
                .ifPresent(builder::variableScope);
        config.getOptionalValue("parlance.matchers.regex", Boolean.class)
                .ifPresent(builder::useRegexMatchers);
        config.getOptionalValue("parlance.http.timeout", String.class)
                .map(timeout -> Duration.parse(timeout.strip()))
                .ifPresent(builder::httpTimeout);
        config.getOptionalValue("parlance.http.threads", Integer.class)
                .ifPresent(builder::httpThreadPoolSize);

        return builder.build();
    }

    /// Closes the environment to release the HTTP thread pool.
    @PreDestroy
    public void cleanup() {
        if (parlanceEnvironment != null) {
            parlanceEnvironment.close();
        }
    }
}
