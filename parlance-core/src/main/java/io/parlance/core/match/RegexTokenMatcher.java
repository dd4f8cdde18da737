package io.parlance.core.match;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// {@link TokenMatcher} built on precompiled regular expressions.
///
/// Selected with `ParlanceConfig.setUseRegexMatchers(true)`. Behaves exactly like
/// {@link StringTokenMatcher}.
///
/// @implNote Thread-safe. `Pattern` instances are immutable and shared.
public final class RegexTokenMatcher implements TokenMatcher {

    private static final Pattern VARIABLE =
            Pattern.compile("^\\[([^\\s\\[\\]{}]|[^\\s\\[\\]{}][^\\[\\]{}]*[^\\s\\[\\]{}])]$");
    private static final Pattern DESTRUCTURING = Pattern.compile("^\\[\\{([^\\[\\]{}]*)}]$");
    private static final Pattern REFERENCE = Pattern.compile("^\\{(.*)}$", Pattern.DOTALL);
    private static final Pattern SEPARATOR = Pattern.compile("\\s*,\\s*");

    @Override
    public boolean isVariable(String token) {
        return token != null && VARIABLE.matcher(token).matches();
    }

    @Override
    public Optional<String> variableName(String token) {
        if (token == null) {
            return Optional.empty();
        }
        Matcher matcher = VARIABLE.matcher(token);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    @Override
    public boolean isDestructuring(String token) {
        return !destructuredNames(token).isEmpty();
    }

    @Override
    public List<String> destructuredNames(String token) {
        if (token == null) {
            return List.of();
        }
        Matcher matcher = DESTRUCTURING.matcher(token);
        if (!matcher.matches()) {
            return List.of();
        }
        return Arrays.stream(SEPARATOR.split(matcher.group(1).trim()))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean isReference(String token) {
        return token != null && REFERENCE.matcher(token).matches();
    }

    @Override
    public String referencePayload(String token) {
        if (token == null) {
            return null;
        }
        Matcher matcher = REFERENCE.matcher(token);
        return matcher.matches() ? matcher.group(1) : token;
    }
}
