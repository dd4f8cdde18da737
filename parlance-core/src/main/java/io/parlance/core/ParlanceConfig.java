package io.parlance.core;

import java.nio.file.Path;
import java.time.Duration;

/// Configuration options for the Parlance interpreter environment.
///
/// Use the {@link Builder} for fluent configuration or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// - `workingDirectory`: `.` (base for relative file paths)
/// - `variableScope`: {@link VariableScope#PER_RUN}
/// - `useRegexMatchers`: `false` (string-based token matchers)
/// - `httpTimeout`: 5 minutes
/// - `httpThreadPoolSize`: `4`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ParlanceFactory}
/// and do not modify after environment creation.
///
/// @see ParlanceFactory#createEnvironment(ParlanceConfig)
/// @see Builder
public class ParlanceConfig {
    private Path workingDirectory = Path.of(".");
    private VariableScope variableScope = VariableScope.PER_RUN;
    private boolean useRegexMatchers = false;
    private Duration httpTimeout = Duration.ofMinutes(5);
    private int httpThreadPoolSize = 4;

    /// Creates a configuration with default values.
    public ParlanceConfig() {}

    /// Returns the directory relative file paths are resolved against.
    ///
    /// @return working directory, never null
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /// Sets the directory relative file paths are resolved against.
    ///
    /// @param workingDirectory base directory, not null
    public void setWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    /// Returns how long variables live.
    ///
    /// @return variable scope, never null
    public VariableScope getVariableScope() {
        return variableScope;
    }

    public void setVariableScope(VariableScope variableScope) {
        this.variableScope = variableScope;
    }

    /// Returns whether token shapes are recognized with regular expressions.
    ///
    /// Both matchers accept the same inputs; the regex one is easier to extend.
    ///
    /// @return `true` for {@link io.parlance.core.match.RegexTokenMatcher}
    public boolean isUseRegexMatchers() {
        return useRegexMatchers;
    }

    public void setUseRegexMatchers(boolean useRegexMatchers) {
        this.useRegexMatchers = useRegexMatchers;
    }

    /// Returns the request timeout applied by network verbs.
    ///
    /// @return timeout, never null
    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public void setHttpTimeout(Duration httpTimeout) {
        this.httpTimeout = httpTimeout;
    }

    /// Returns the number of threads behind the shared HTTP client.
    ///
    /// @return pool size, positive
    public int getHttpThreadPoolSize() {
        return httpThreadPoolSize;
    }

    /// Sets the number of threads behind the shared HTTP client.
    ///
    /// ### Contracts
    /// - **Precondition**: `httpThreadPoolSize` should be positive
    ///
    /// @param httpThreadPoolSize the number of threads, must be positive
    public void setHttpThreadPoolSize(int httpThreadPoolSize) {
        this.httpThreadPoolSize = httpThreadPoolSize;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ParlanceConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final ParlanceConfig config = new ParlanceConfig();

        /// Sets the base directory for relative file paths.
        ///
        /// @param workingDirectory base directory, not null
        /// @return this builder for chaining, never null
        public Builder workingDirectory(Path workingDirectory) {
            config.workingDirectory = workingDirectory;
            return this;
        }

        /// Sets the variable lifetime.
        ///
        /// @param variableScope scope, not null
        /// @return this builder for chaining, never null
        public Builder variableScope(VariableScope variableScope) {
            config.variableScope = variableScope;
            return this;
        }

        /// Selects the regex-based token matchers.
        ///
        /// @param useRegexMatchers `true` for regex matchers, `false` for string matchers
        /// @return this builder for chaining, never null
        public Builder useRegexMatchers(boolean useRegexMatchers) {
            config.useRegexMatchers = useRegexMatchers;
            return this;
        }

        /// Sets the timeout of network verbs.
        ///
        /// @param httpTimeout timeout, not null
        /// @return this builder for chaining, never null
        public Builder httpTimeout(Duration httpTimeout) {
            config.httpTimeout = httpTimeout;
            return this;
        }

        /// Sets the HTTP client pool size.
        ///
        /// @param httpThreadPoolSize the number of threads, must be positive
        /// @return this builder for chaining, never null
        public Builder httpThreadPoolSize(int httpThreadPoolSize) {
            config.httpThreadPoolSize = httpThreadPoolSize;
            return this;
        }

        /// Builds and returns the configured {@link ParlanceConfig} instance.
        ///
        /// @return the configured instance, never null
        public ParlanceConfig build() {
            return config;
        }
    }
}
