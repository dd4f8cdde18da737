package io.parlance.cli.commands;

import io.parlance.cli.shell.ShellSession;
import io.parlance.core.VariableScope;
import java.util.Scanner;
import picocli.CommandLine;

/// Starts the interactive shell.
///
/// Variables assigned by one sentence stay visible to the next while the engine runs in
/// {@link VariableScope#SESSION} scope, which is the CLI default.
///
/// ### Usage
/// ```bash
/// parlance shell
/// ```
///
/// @see ShellSession
@CommandLine.Command(name = "shell", description = "Start an interactive shell")
class ShellCommand extends ParlanceCommand {

    @Override
    protected void execute() {
        if (environment.getEngine().scope() != VariableScope.SESSION) {
            System.out.println(
                    styles().warn(" [WARN] Variables are reset after every sentence"
                            + " (parlance.variables.scope=PER_RUN)"));
        }
        new ShellSession(new Scanner(System.in), System.out, environment, styles()).run();
    }
}
