package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// `POST payload TO url.` sends a JSON body and returns the response body.
public final class PostJson implements Verb {

    private static final Logger logger = Logger.getLogger(PostJson.class.getName());

    @Override
    public String name() {
        return "POST";
    }

    @Override
    public String usage() {
        return "Json";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT, Role.TO);
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        return role == Role.TO ? HttpVerbs.httpUri(text) : Optional.of(Value.text(text));
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        URI target = instance.uri(Role.TO);
        HttpRequest request =
                HttpRequest.newBuilder(target)
                        .timeout(instance.services().httpTimeout())
                        .header("Content-Type", "application/json; charset=utf-8")
                        .POST(
                                HttpRequest.BodyPublishers.ofString(
                                        instance.text(Role.WHAT), StandardCharsets.UTF_8))
                        .build();
        HttpResponse<String> response =
                HttpVerbs.send(
                        instance, request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() >= 400) {
            logger.warning("POST to " + target + " returned HTTP " + response.statusCode());
        }
        return Value.text(response.body());
    }
}
