package io.parlance.core.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// {@link TokenMatcher} built on plain string inspection. This is the default.
///
/// @implNote Stateless and thread-safe.
public final class StringTokenMatcher implements TokenMatcher {

    @Override
    public boolean isVariable(String token) {
        return variableName(token).isPresent();
    }

    @Override
    public Optional<String> variableName(String token) {
        if (token == null || token.length() < 3 || !token.startsWith("[") || !token.endsWith("]")) {
            return Optional.empty();
        }
        String name = token.substring(1, token.length() - 1);
        if (Character.isWhitespace(name.charAt(0))
                || Character.isWhitespace(name.charAt(name.length() - 1))) {
            return Optional.empty();
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '[' || c == ']' || c == '{' || c == '}') {
                return Optional.empty();
            }
        }
        return Optional.of(name);
    }

    @Override
    public boolean isDestructuring(String token) {
        return !destructuredNames(token).isEmpty();
    }

    @Override
    public List<String> destructuredNames(String token) {
        if (token == null || token.length() < 4 || !token.startsWith("[{") || !token.endsWith("}]")) {
            return List.of();
        }
        String inner = token.substring(2, token.length() - 2);
        if (inner.indexOf('{') >= 0
                || inner.indexOf('}') >= 0
                || inner.indexOf('[') >= 0
                || inner.indexOf(']') >= 0) {
            return List.of();
        }

        List<String> names = new ArrayList<>();
        for (String part : inner.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return List.copyOf(names);
    }

    @Override
    public boolean isReference(String token) {
        return token != null && token.length() >= 2 && token.startsWith("{") && token.endsWith("}");
    }

    @Override
    public String referencePayload(String token) {
        return isReference(token) ? token.substring(1, token.length() - 1) : token;
    }
}
