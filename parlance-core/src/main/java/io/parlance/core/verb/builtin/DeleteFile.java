package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/// `DELETE FROM file.` or `DELETE file.` removes a file.
///
/// A missing file is not an error; the result says so.
public final class DeleteFile implements Verb {

    @Override
    public String name() {
        return "DELETE";
    }

    @Override
    public String usage() {
        return "File";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.FROM);
    }

    @Override
    public Optional<Role> implicitRole() {
        return Optional.of(Role.FROM);
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        return FileVerbs.path(text);
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        Path file = instance.path(Role.FROM);
        String shown = instance.text(Role.FROM);
        if (Files.isDirectory(file)) {
            throw new VerbExecutionException("Not a file: " + shown);
        }
        try {
            return Files.deleteIfExists(file)
                    ? Value.text("Deleted: " + shown)
                    : Value.text("File not found: " + shown);
        } catch (IOException e) {
            throw new VerbExecutionException("Cannot delete " + shown + ": " + e.getMessage(), e);
        }
    }
}
