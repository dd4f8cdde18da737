package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// `TRANSFORM text USING charset.` encodes text in a charset and returns the bytes as Base64.
public final class TransformEncoding implements Verb {

    private static final Map<String, Charset> ALIASES =
            Map.of(
                    "UNICODE", StandardCharsets.UTF_16LE,
                    "UTF8", StandardCharsets.UTF_8,
                    "ASCII", StandardCharsets.US_ASCII,
                    "LATIN1", StandardCharsets.ISO_8859_1);

    @Override
    public String name() {
        return "TRANSFORM";
    }

    @Override
    public String usage() {
        return "Encoding";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT, Role.USING);
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        if (role != Role.USING) {
            return Optional.of(Value.text(text));
        }
        return charset(text).<Value>map(Value.Handle::new);
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        Charset charset = instance.handle(Role.USING, Charset.class);
        byte[] bytes = instance.text(Role.WHAT).getBytes(charset);
        return Value.text(Base64.getEncoder().encodeToString(bytes));
    }

    static Optional<Charset> charset(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        Charset alias = ALIASES.get(trimmed.toUpperCase(Locale.ROOT).replace("-", ""));
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            return Optional.of(Charset.forName(trimmed));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
