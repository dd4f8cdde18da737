package io.parlance.cli.commands;

import io.parlance.cli.ui.AnsiStyles;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.sentence.Sentence;
import java.util.List;
import picocli.CommandLine;

/// CLI command for checking a sentence without executing it.
///
/// Tokenizes, validates and dispatches the sentence, then prints the chosen
/// implementation of every step in its `THEN`-chain. Nothing is read, written or sent.
///
/// ### Usage
/// ```bash
/// parlance validate 'DELETE {old.log}.'
/// ```
@CommandLine.Command(name = "validate", description = "Validate a sentence without running it")
class SentenceValidateCommand extends ParlanceCommand {

    @CommandLine.Parameters(description = "Sentence words", arity = "1..*")
    private List<String> words;

    @Override
    protected void execute() {
        String sentence = words == null ? "" : String.join(" ", words).strip();
        ExecutionResult outcome = environment.getEngine().validate(sentence);

        if (!outcome.isSuccess()) {
            System.err.println(" [FAIL] Validation failed: " + outcome.failureReason());
            return;
        }

        AnsiStyles styles = styles();
        Sentence parsed = outcome.sentence();
        System.out.println(" [OK] Sentence is valid!");
        System.out.println("   Verb: " + parsed.root().descriptor().id());
        System.out.println("   Steps: " + parsed.steps());

        int index = 1;
        System.out.println("   " + index++ + ". " + styles.verb(parsed.root().descriptor().id()));
        for (Sentence sub : parsed.subSentences()) {
            String id = sub.root().descriptor().id();
            System.out.println("   " + index++ + ". " + styles.arrow() + " " + styles.verb(id));
        }
    }
}
