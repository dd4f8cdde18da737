package io.parlance.cli.commands;

import io.parlance.cli.ui.AnsiStyles;
import io.parlance.core.ParlanceEnvironment;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for all Parlance CLI commands.
///
/// Prints the banner, then delegates to {@link #execute()}. Subclasses receive the
/// shared {@link ParlanceEnvironment} through CDI.
///
/// ### Color Resolution
/// Colors are used when the config property `parlance.color` is true and the
/// `--no-color` option is absent.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see SentenceRunCommand
/// @see ShellCommand
public abstract class ParlanceCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "                  _",
        "  _ __   __ _ _ _| | __ _ _ _   __ ___",
        " | '_ \\ / _` | '_| |/ _` | ' \\ / _/ -_)",
        " | .__/ \\__,_|_| |_|\\__,_|_||_|\\__\\___|",
        " |_|",
        "",
        " Say what you want done",
        ""
    };

    @Option(names = "--no-color", description = "Disable ANSI colors in the output")
    protected boolean noColor;

    @Inject
    @ConfigProperty(name = "parlance.color", defaultValue = "true")
    boolean colorEnabled;

    @Inject ParlanceEnvironment environment;

    @Override
    public final void run() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    /// Whether the banner is printed before {@link #execute()}.
    protected boolean showBanner() {
        return true;
    }

    /// Returns the styles for this invocation.
    ///
    /// @return styles honoring `parlance.color` and `--no-color`, never null
    protected AnsiStyles styles() {
        return AnsiStyles.of(colorEnabled && !noColor);
    }
}
