package io.parlance.cli.commands;

import io.parlance.cli.ui.VerbCatalogPrinter;
import io.parlance.core.lexicon.Lexicon;
import picocli.CommandLine;

/// Lists the registered verbs grouped by family.
///
/// ### Usage
/// ```bash
/// parlance verbs
/// ```
@CommandLine.Command(name = "verbs", description = "List available verbs")
class VerbListCommand extends ParlanceCommand {

    @Override
    protected void execute() {
        Lexicon lexicon = environment.getLexicon();
        int usages = new VerbCatalogPrinter(lexicon, styles()).print(System.out);
        int families = lexicon.families().size();
        System.out.println();
        System.out.println(" " + usages + " usage(s) in " + families + " verb famil"
                + (families == 1 ? "y" : "ies"));
    }
}
