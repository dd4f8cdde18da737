package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// `SAVE text TO file.` writes text to a file, replacing it, and returns what was written.
public final class SaveText implements Verb {

    private static final Logger logger = Logger.getLogger(SaveText.class.getName());

    @Override
    public String name() {
        return "SAVE";
    }

    @Override
    public String usage() {
        return "Text";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT, Role.TO);
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        return role == Role.TO ? FileVerbs.path(text) : Optional.of(Value.text(text));
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        Path file = instance.path(Role.TO);
        Value content = instance.value(Role.WHAT).orElse(Value.text(""));
        try {
            FileVerbs.createParents(file);
            Files.writeString(file, content.asText(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VerbExecutionException(
                    "Cannot write " + instance.text(Role.TO) + ": " + e.getMessage(), e);
        }
        logger.fine(() -> "Saved " + file);
        return content;
    }
}
