package io.parlance.serialization.verb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import io.parlance.core.word.Word;
import io.parlance.serialization.JsonValues;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// `LOAD [config] FROM settings.json.` reads a JSON object file as a structured value.
///
/// Takes precedence over `LOAD TEXT` when the source is a `.json` literal or
/// reference; any other source falls through to the next `LOAD` usage.
public final class LoadConfig implements Verb {

    static final int PRIORITY = 10;

    private final ObjectMapper objectMapper;

    /// Creates the verb.
    ///
    /// @param objectMapper mapper to parse files with, not null
    public LoadConfig(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String name() {
        return "LOAD";
    }

    @Override
    public String usage() {
        return "Config";
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
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean accepts(Role role, Word word) {
        if (role != Role.FROM) {
            return word.isValue();
        }
        String source;
        if (word instanceof Word.ReferenceWord reference) {
            source = reference.payload();
        } else if (word instanceof Word.LiteralWord literal) {
            source = literal.text();
        } else {
            return false;
        }
        return source.trim().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        if (role != Role.FROM) {
            return Optional.of(Value.text(text));
        }
        if (text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Value.Handle(Path.of(text.trim())));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        Path file = instance.path(Role.FROM);
        String shown = instance.text(Role.FROM);
        if (!Files.isRegularFile(file)) {
            throw new VerbExecutionException("Configuration file not found: " + shown);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new VerbExecutionException(
                    "Invalid JSON in " + shown + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new VerbExecutionException("Cannot read " + shown + ": " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new VerbExecutionException(
                    "Configuration in " + shown + " must be a JSON object");
        }
        return new Value.Structured(JsonValues.properties(node));
    }
}
