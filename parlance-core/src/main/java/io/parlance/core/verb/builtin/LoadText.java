package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/// `LOAD [lines] FROM file.` loads a text file as lines; a missing file is reported with its full path.
public final class LoadText implements Verb {

    @Override
    public String name() {
        return "LOAD";
    }

    @Override
    public String usage() {
        return "Text";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT, Role.FROM);
    }

    @Override
    public boolean producesWhat() {
        return true;
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        return role == Role.FROM ? FileVerbs.path(text) : Optional.of(Value.text(text));
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        Path file = instance.path(Role.FROM);
        return Value.lines(FileVerbs.readLines(file, file.toAbsolutePath().normalize().toString()));
    }
}
