package io.parlance.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Parlance CLI application.
///
/// Registers the available subcommands:
/// - `run` - Execute sentences given inline or read from a script file
/// - `validate` - Check a sentence without executing it
/// - `verbs` - List the registered verbs, their usages and prepositions
/// - `shell` - Interactive prompt that keeps variables between sentences
///
/// @see SentenceRunCommand
/// @see SentenceValidateCommand
/// @see VerbListCommand
/// @see ShellCommand
@TopCommand
@Command(
        name = "parlance",
        description = "English-like command interpreter",
        mixinStandardHelpOptions = true,
        subcommands = {
            SentenceRunCommand.class,
            SentenceValidateCommand.class,
            VerbListCommand.class,
            ShellCommand.class
        })
public class ParlanceCLI {}
