package io.parlance.serialization.verb;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.parlance.core.verb.VerbModule;
import io.parlance.core.verb.VerbRegistry;
import java.util.Objects;

/// Registers the JSON-backed verbs: `LOAD CONFIG`.
public final class JsonVerbs implements VerbModule {

    private final ObjectMapper objectMapper;

    /// Creates the module.
    ///
    /// @param objectMapper mapper shared by the registered verbs, not null
    public JsonVerbs(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void register(VerbRegistry registry) {
        registry.register(() -> new LoadConfig(objectMapper));
    }
}
