package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.util.Optional;
import java.util.Set;

/// `GET [lines] FROM file.` reads a text file as lines.
public final class GetText implements Verb {

    @Override
    public String name() {
        return "GET";
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
        return Value.lines(FileVerbs.readLines(instance.path(Role.FROM), instance.text(Role.FROM)));
    }
}
