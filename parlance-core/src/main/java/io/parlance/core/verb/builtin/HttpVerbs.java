package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.VerbInstance;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Optional;

/// Shared HTTP handling of the built-in network verbs.
final class HttpVerbs {

    private HttpVerbs() {}

    /// Converts text to an absolute `http` or `https` URI handle.
    ///
    /// @return the URI, or empty for anything else
    static Optional<Value> httpUri(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(text.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null || scheme == null) {
                return Optional.empty();
            }
            String lower = scheme.toLowerCase(Locale.ROOT);
            if (!lower.equals("http") && !lower.equals("https")) {
                return Optional.empty();
            }
            return Optional.of(new Value.Handle(uri));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /// Sends a request with the environment's client, honoring the caller's cancellation.
    static <T> HttpResponse<T> send(
            VerbInstance instance, HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws VerbExecutionException {
        String action = instance.descriptor().name();
        if (instance.cancellation().isCancellationRequested()) {
            throw new VerbExecutionException(action + " cancelled before sending " + request.uri());
        }
        try {
            return instance.services().httpClient().send(request, handler);
        } catch (IOException e) {
            throw new VerbExecutionException(
                    action + " failed for " + request.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VerbExecutionException(action + " interrupted for " + request.uri(), e);
        }
    }
}
