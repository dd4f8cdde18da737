package io.parlance.cli.commands;

import io.parlance.cli.ui.AnsiStyles;
import io.parlance.core.ParlanceEngine;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.serialization.ExecutionReport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/// CLI command for executing sentences.
///
/// Sentences come either from the positional words, joined with single spaces, or from a
/// script file with one sentence per line. Blank lines and lines starting with `#` are
/// skipped. Execution stops at the first failed sentence unless `--keep-going` is set.
///
/// ### Usage
/// ```bash
/// parlance run 'GET [text] FROM {notes.txt} THEN SAY [text].'
/// parlance run -f script.txt --keep-going
/// parlance run --json 'SAY hello.'
/// ```
///
/// With `--json` the banner is suppressed and every sentence produces one JSON report.
///
/// @see ExecutionReport
@CommandLine.Command(name = "run", description = "Execute sentences")
class SentenceRunCommand extends ParlanceCommand {

    @CommandLine.Parameters(description = "Sentence words", arity = "0..*")
    private List<String> words;

    @CommandLine.Option(
            names = {"-f", "--file"},
            description = "Script file with one sentence per line")
    private Path script;

    @CommandLine.Option(
            names = "--keep-going",
            description = "Continue with the next sentence after a failure")
    private boolean keepGoing;

    @CommandLine.Option(names = "--json", description = "Print a JSON report per sentence")
    private boolean json;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected void execute() {
        List<String> sentences;
        try {
            sentences = collectSentences();
        } catch (IOException e) {
            System.err.println(" [FAIL] Cannot read script: " + e.getMessage());
            return;
        }

        if (sentences.isEmpty()) {
            System.err.println(
                    """
                     [FAIL] No sentence given.
                     Usage: parlance run <sentence...>
                        Or: parlance run -f <script>
                    """);
            return;
        }

        ParlanceEngine engine = environment.getEngine();
        AnsiStyles styles = styles();
        int succeeded = 0;
        int failures = 0;

        for (String sentence : sentences) {
            Instant startedAt = Instant.now();
            long start = System.nanoTime();
            ExecutionResult outcome = engine.run(sentence);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            if (json) {
                System.out.println(
                        ExecutionReport.of(
                                        sentence,
                                        outcome,
                                        engine.variables(),
                                        startedAt,
                                        elapsed)
                                .toJson());
            } else {
                report(styles, sentence, outcome);
            }

            if (outcome.isSuccess()) {
                succeeded++;
            } else {
                failures++;
                if (!keepGoing) {
                    break;
                }
            }
        }

        if (!json && sentences.size() > 1) {
            System.out.println(
                    styles.outcome(
                            " " + succeeded + " succeeded, " + failures + " failed",
                            failures == 0));
        }
    }

    private void report(AnsiStyles styles, String sentence, ExecutionResult outcome) {
        if (!outcome.isSuccess()) {
            System.err.println(" [FAIL] " + sentence);
            System.err.println("   " + outcome.failureReason());
            return;
        }
        System.out.println(" [OK] " + styles.bold(sentence));
        System.out.println(
                "   "
                        + styles.verb(outcome.sentence().root().descriptor().id())
                        + styles.dim(" (" + outcome.sentence().steps() + " step(s))"));
        if (outcome.result() != null) {
            System.out.println(
                    "   " + styles.arrow() + " "
                            + styles.dim(AnsiStyles.preview(outcome.result().asText(), 120)));
        }
    }

    /// Reads sentences from the script file or joins the positional words.
    List<String> collectSentences() throws IOException {
        List<String> sentences = new ArrayList<>();
        if (script != null) {
            for (String line : Files.readAllLines(script, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    sentences.add(trimmed);
                }
            }
        } else if (words != null && !words.isEmpty()) {
            String joined = String.join(" ", words).strip();
            if (!joined.isEmpty()) {
                sentences.add(joined);
            }
        }
        return sentences;
    }
}
