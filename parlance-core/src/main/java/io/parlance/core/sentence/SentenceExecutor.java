package io.parlance.core.sentence;

import io.parlance.core.dispatch.DispatchedVerb;
import io.parlance.core.exception.ResolutionException;
import io.parlance.core.exception.StructuredValueException;
import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.match.TokenMatcher;
import io.parlance.core.value.Value;
import io.parlance.core.variable.StructuredValueReader;
import io.parlance.core.variable.VariableResolver;
import io.parlance.core.verb.CancellationToken;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import io.parlance.core.verb.VerbServices;
import io.parlance.core.word.Word;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Runs dispatched sentences against a variable table.
///
/// For every step of a sentence, in order:
/// 1. resolve each role's words to a {@link Value}
/// 2. invoke the verb
/// 3. store the result when the direct object is a `[variable]` or `[{a, b}]`
///
/// The first failure stops the chain. Steps that already ran are not undone.
///
/// @implNote Stateless; the variable table is passed per call.
public final class SentenceExecutor {

    private static final Logger logger = Logger.getLogger(SentenceExecutor.class.getName());

    private final StructuredValueReader structuredValueReader;
    private final TokenMatcher matcher;
    private final VerbServices services;

    public SentenceExecutor(
            StructuredValueReader structuredValueReader,
            TokenMatcher matcher,
            VerbServices services) {
        this.structuredValueReader =
                Objects.requireNonNull(structuredValueReader, "structuredValueReader must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.services = Objects.requireNonNull(services, "services must not be null");
    }

    /// Runs a sentence and its `THEN`-chain.
    ///
    /// @param sentence sentence to run, may be null
    /// @param variables table read and written by every step, not null
    /// @param cancellation passed through to each verb, not null
    /// @return the last step's result, or null for a null sentence
    /// @throws ResolutionException if a role value cannot be resolved
    /// @throws VerbExecutionException if a verb fails
    /// @throws StructuredValueException if a result cannot be destructured
    public Value execute(
            Sentence sentence, VariableResolver variables, CancellationToken cancellation)
            throws ResolutionException, VerbExecutionException, StructuredValueException {
        if (sentence == null || sentence.root() == null) {
            return null;
        }
        Objects.requireNonNull(variables, "variables must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        Value result = step(sentence.root(), variables, cancellation);
        for (Sentence next : sentence.subSentences()) {
            result = step(next.root(), variables, cancellation);
        }
        return result;
    }

    private Value step(
            DispatchedVerb dispatched, VariableResolver variables, CancellationToken cancellation)
            throws ResolutionException, VerbExecutionException, StructuredValueException {
        Optional<Word.VariableWord> output = outputSlot(dispatched);

        Map<Role, Value> values = new EnumMap<>(Role.class);
        for (Map.Entry<Role, List<Word>> entry : dispatched.roleWords().entrySet()) {
            if (entry.getKey() == Role.WHAT && output.isPresent()) {
                continue;
            }
            values.put(entry.getKey(), bind(dispatched, entry.getKey(), entry.getValue(), variables));
        }

        VerbInstance instance =
                new VerbInstance(dispatched.descriptor(), dispatched.verb(), values, services, cancellation);
        logger.fine(() -> "Executing " + instance);

        Value result;
        try {
            result = instance.invoke();
        } catch (RuntimeException e) {
            logger.warning(dispatched.descriptor().id() + " failed: " + e);
            throw new VerbExecutionException(
                    dispatched.descriptor().id() + " failed: " + e.getMessage(), e);
        }

        Optional<Word.VariableWord> target = dispatched.whatVariable();
        if (target.isPresent()) {
            store(target.get(), result, variables);
        }
        return result;
    }

    /// A lone `[variable]` in the direct object is only written to when the verb
    /// produces it or the token asks for destructuring.
    private static Optional<Word.VariableWord> outputSlot(DispatchedVerb dispatched) {
        return dispatched
                .whatVariable()
                .filter(v -> v.destructuring() || dispatched.descriptor().producesWhat());
    }

    private Value bind(DispatchedVerb dispatched, Role role, List<Word> words, VariableResolver variables)
            throws ResolutionException {
        Verb verb = dispatched.verb();

        if (words.size() == 1 && words.get(0) instanceof Word.VariableWord variable) {
            Value value = lookup(variable, variables);
            if (value instanceof Value.Text text) {
                return convert(dispatched, role, text.value(), variable.text());
            }
            return value;
        }

        List<String> parts = new ArrayList<>(words.size());
        for (Word word : words) {
            if (word instanceof Word.VariableWord variable) {
                parts.add(lookup(variable, variables).asText());
            } else if (word instanceof Word.ReferenceWord reference) {
                parts.add(reference.payload());
            } else {
                parts.add(word.text());
            }
        }
        String text = String.join(" ", parts);
        if (words.size() == 1 && words.get(0) instanceof Word.ReferenceWord) {
            return convert(dispatched, role, text, words.get(0).text());
        }
        return convert(dispatched, role, unquote(text), text);
    }

    private Value lookup(Word.VariableWord variable, VariableResolver variables)
            throws ResolutionException {
        if (variable.destructuring()) {
            throw new ResolutionException(
                    "Destructuring " + variable.text() + " can only receive a result");
        }
        Value value = variables.resolve(variable.text());
        if (value == null) {
            throw new ResolutionException("Variable " + variable.text() + " not found");
        }
        return value;
    }

    private static Value convert(DispatchedVerb dispatched, Role role, String text, String shown)
            throws ResolutionException {
        Optional<Value> converted;
        try {
            converted = dispatched.verb().resolve(role, text);
        } catch (RuntimeException e) {
            throw new ResolutionException(
                    "Cannot resolve '" + shown + "' for " + role + " of "
                            + dispatched.descriptor().id() + ": " + e.getMessage());
        }
        if (converted == null || converted.isEmpty()) {
            throw new ResolutionException(
                    String.format(
                            "Cannot resolve '%s' for %s of %s",
                            shown, role, dispatched.descriptor().id()));
        }
        return converted.get();
    }

    private void store(Word.VariableWord target, Value result, VariableResolver variables)
            throws ResolutionException, StructuredValueException {
        if (target.destructuring()) {
            Map<String, Value> properties = structuredValueReader.read(result);
            for (String name : matcher.destructuredNames(target.text())) {
                Optional<Value> property = property(properties, name);
                if (property.isPresent()) {
                    variables.register(name, property.get());
                } else {
                    logger.fine(() -> "Property '" + name + "' absent, not stored");
                }
            }
            return;
        }
        Optional<String> name = matcher.variableName(target.text());
        if (name.isEmpty()) {
            throw new ResolutionException("Invalid variable name: " + target.text());
        }
        variables.register(name.get(), result);
    }

    private static Optional<Value> property(Map<String, Value> properties, String name) {
        Value exact = properties.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return properties.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /// Removes one pair of surrounding double quotes.
    static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
