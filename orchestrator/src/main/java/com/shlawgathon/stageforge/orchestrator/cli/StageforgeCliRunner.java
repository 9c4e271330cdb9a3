package com.shlawgathon.stageforge.orchestrator.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli and keeps its exit code for
 * {@code SpringApplication.exit}.
 */
@Component
public class StageforgeCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final StageforgeCommand command;
    private final IFactory factory;

    private int exitCode;

    public StageforgeCliRunner(StageforgeCommand command, IFactory factory) {
        this.command = command;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
