package io.parlance.cli.shell;

import io.parlance.cli.ui.AnsiStyles;
import io.parlance.cli.ui.VerbCatalogPrinter;
import io.parlance.core.ParlanceEngine;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.value.Value;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Scanner;

/// Read-eval-print loop over a {@link ParlanceEngine}.
///
/// Each input line is either a shell command or a sentence. A line is a shell command when
/// its first word names one and it does not end with a terminator (`.`, `?` or `!`), so
/// sentences are never shadowed by commands.
///
/// | Command | Effect |
/// |---------|--------|
/// | `help` | list shell commands |
/// | `vars` | show variables and their values |
/// | `set <name> <value>` | assign a text variable |
/// | `history` | show the sentences run so far |
/// | `verbs` | list available verbs |
/// | `clear` | remove all variables |
/// | `exit`, `quit` | leave the shell |
///
/// @implNote **Not thread-safe**. Reads from a Scanner, writes to a PrintStream.
public class ShellSession {

    static final String PROMPT = "parlance> ";

    private final Scanner scanner;
    private final PrintStream out;
    private final ParlanceEnvironment environment;
    private final AnsiStyles styles;
    private final List<String> history = new ArrayList<>();

    public ShellSession(
            Scanner scanner, PrintStream out, ParlanceEnvironment environment, AnsiStyles styles) {
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
    }

    /// Runs until `exit`, `quit` or end of input.
    public void run() {
        out.println(styles.dim("Type a sentence ending in '.', or 'help' for commands."));
        while (true) {
            out.print(PROMPT);
            out.flush();
            if (!scanner.hasNextLine()) {
                out.println();
                break;
            }
            if (!handle(scanner.nextLine())) {
                break;
            }
        }
        out.println("Bye.");
    }

    /// Handles one input line.
    ///
    /// @param line raw input, not null
    /// @return false when the session should end
    public boolean handle(String line) {
        String input = line.strip();
        if (input.isEmpty()) {
            return true;
        }
        if (isCommand(input)) {
            return command(input);
        }
        sentence(input);
        return true;
    }

    /// Returns the sentences run so far, oldest first.
    public List<String> history() {
        return Collections.unmodifiableList(history);
    }

    private static boolean isCommand(String input) {
        char last = input.charAt(input.length() - 1);
        if (last == '.' || last == '?' || last == '!') {
            return false;
        }
        return switch (firstWord(input)) {
            case "help", "vars", "set", "history", "verbs", "clear", "exit", "quit" -> true;
            default -> false;
        };
    }

    private static String firstWord(String input) {
        int space = input.indexOf(' ');
        return (space < 0 ? input : input.substring(0, space)).toLowerCase(Locale.ROOT);
    }

    private boolean command(String input) {
        ParlanceEngine engine = environment.getEngine();
        switch (firstWord(input)) {
            case "exit", "quit" -> {
                return false;
            }
            case "help" -> printHelp();
            case "vars" -> printVariables(engine.variables());
            case "set" -> set(engine, input);
            case "history" -> printHistory();
            case "verbs" -> new VerbCatalogPrinter(environment.getLexicon(), styles).print(out);
            case "clear" -> {
                engine.clearVariables();
                out.println(styles.dim("Variables cleared."));
            }
            default -> out.println(styles.warn("Unknown command. Type 'help'."));
        }
        return true;
    }

    private void sentence(String input) {
        history.add(input);
        ExecutionResult outcome = environment.getEngine().run(input);
        if (!outcome.isSuccess()) {
            out.println(styles.crossmark() + " " + styles.error(outcome.failureReason()));
            return;
        }
        Value result = outcome.result();
        String preview = result == null ? "" : AnsiStyles.preview(result.asText(), 200);
        out.println(styles.checkmark() + " " + styles.dim(preview));
    }

    private void set(ParlanceEngine engine, String input) {
        String[] parts = input.split("\\s+", 3);
        if (parts.length < 3) {
            out.println(styles.warn("Usage: set <name> <value>"));
            return;
        }
        String name = parts[1];
        if (name.startsWith("[") && name.endsWith("]") && name.length() > 2) {
            name = name.substring(1, name.length() - 1);
        }
        try {
            engine.registerVariable(name, parts[2]);
            out.println(styles.variable(name) + " = " + parts[2]);
        } catch (IllegalArgumentException e) {
            out.println(styles.error(e.getMessage()));
        }
    }

    private void printVariables(Map<String, Value> variables) {
        if (variables.isEmpty()) {
            out.println(styles.dim("No variables."));
            return;
        }
        variables.forEach(
                (name, value) ->
                        out.println(
                                styles.variable(name)
                                        + styles.dim(" (" + value.getClass().getSimpleName() + ")")
                                        + " = "
                                        + AnsiStyles.preview(value.asText(), 80)));
    }

    private void printHistory() {
        if (history.isEmpty()) {
            out.println(styles.dim("No sentences yet."));
            return;
        }
        for (int i = 0; i < history.size(); i++) {
            out.printf("%3d  %s%n", i + 1, history.get(i));
        }
    }

    private void printHelp() {
        out.println(styles.bold("Shell commands:"));
        out.println("  help                 show this list");
        out.println("  vars                 show variables");
        out.println("  set <name> <value>   assign a text variable");
        out.println("  history              show sentences run so far");
        out.println("  verbs                list available verbs");
        out.println("  clear                remove all variables");
        out.println("  exit                 leave the shell");
        out.println(styles.dim("Anything ending in '.', '?' or '!' runs as a sentence, e.g.")
                + " SAY hello THEN SAY world.");
    }
}
