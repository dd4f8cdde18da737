package io.parlance.core.verb;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/// Runtime services shared by all verb actions of one environment.
///
/// @param output stream that output verbs write to, not null
/// @param workingDirectory base for relative file paths, not null
/// @param httpClient client for network verbs, not null
/// @param httpTimeout per-request timeout for network verbs, not null
public record VerbServices(
        PrintStream output, Path workingDirectory, HttpClient httpClient, Duration httpTimeout) {

    public VerbServices {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        Objects.requireNonNull(httpClient, "httpClient must not be null");
        Objects.requireNonNull(httpTimeout, "httpTimeout must not be null");
    }

    /// Resolves a path against the working directory unless it is already absolute.
    ///
    /// @param path path to resolve, not null
    /// @return absolute or working-directory-relative path, never null
    public Path resolve(Path path) {
        return path.isAbsolute() ? path : workingDirectory.resolve(path);
    }
}
