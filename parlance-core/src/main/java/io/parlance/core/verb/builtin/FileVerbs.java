package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// Shared file handling of the built-in verbs.
final class FileVerbs {

    private FileVerbs() {}

    /// Converts text to a path handle.
    ///
    /// @return the path, or empty for blank or malformed text
    static Optional<Value> path(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Value.Handle(Path.of(text.trim())));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    static List<String> readLines(Path path, String shown) throws VerbExecutionException {
        if (!Files.isRegularFile(path)) {
            throw new VerbExecutionException("File not found: " + shown);
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VerbExecutionException("Cannot read " + shown + ": " + e.getMessage(), e);
        }
    }

    static void createParents(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
