package com.shlawgathon.stageforge.orchestrator.cli;

import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.model.CheckpointIndexEntry;
import com.shlawgathon.stageforge.orchestrator.repository.CheckpointStore;
import com.shlawgathon.stageforge.orchestrator.service.PipelineService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Inspects and prunes a checkpoint directory.
 */
@Component
@Command(
        name = "checkpoints",
        description = "List or prune saved checkpoints",
        mixinStandardHelpOptions = true
)
public class CheckpointsCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private final PipelineService pipelineService;

    public CheckpointsCommand(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "list", description = "List checkpoints, oldest first")
    public int list(
            @Option(names = "--checkpoint-dir", paramLabel = "<dir>", description = "Checkpoint directory")
            Path checkpointDir) {
        PrintWriter out = spec.commandLine().getOut();
        CheckpointStore store = store(checkpointDir);
        try {
            List<CheckpointIndexEntry> entries = store.list();
            if (entries.isEmpty()) {
                out.println("No checkpoints in " + store.getDirectory());
            }
            for (CheckpointIndexEntry entry : entries) {
                out.printf("%-48s %-20s %s%n", entry.getCheckpointId(), entry.getStageName(), entry.getCreatedAt());
            }
            out.flush();
            return 0;
        } catch (CheckpointError e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        }
    }

    @Command(name = "prune", description = "Delete all but the newest checkpoints")
    public int prune(
            @Option(names = "--keep", paramLabel = "<n>", defaultValue = "3",
                    description = "Checkpoints to keep (default: ${DEFAULT-VALUE})")
            int keep,
            @Option(names = "--checkpoint-dir", paramLabel = "<dir>", description = "Checkpoint directory")
            Path checkpointDir) {
        PrintWriter out = spec.commandLine().getOut();
        try {
            int removed = store(checkpointDir).cleanup(keep);
            out.printf("Removed %d checkpoint(s), kept up to %d%n", removed, keep);
            out.flush();
            return 0;
        } catch (CheckpointError | IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        }
    }

    private CheckpointStore store(Path checkpointDir) {
        Path directory = checkpointDir != null
                ? checkpointDir
                : Path.of(pipelineService.defaultConfig().build().getCheckpointDir());
        return pipelineService.openStore(directory);
    }
}
