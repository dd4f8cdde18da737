package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.util.Set;

/// `SAY message.` prints a message and returns it. Lines print one per row.
public final class SayText implements Verb {

    @Override
    public String name() {
        return "SAY";
    }

    @Override
    public String usage() {
        return "Text";
    }

    @Override
    public Set<String> synonyms() {
        return Set.of("ECHO", "PRINT", "OUTPUT", "WRITE");
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT);
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        String message = instance.text(Role.WHAT);
        instance.services().output().println(message);
        return Value.text(message);
    }
}
