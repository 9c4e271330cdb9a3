package com.shlawgathon.stageforge.orchestrator.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root of the command tree. Prints usage when invoked without a subcommand.
 */
@Component
@Command(
        name = "stageforge",
        description = "Resumable stage pipeline runner",
        mixinStandardHelpOptions = true,
        version = "stageforge 1.0.0",
        subcommands = {
                RunCommand.class,
                CheckpointsCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class StageforgeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
