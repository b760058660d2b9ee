package com.workforce.dispatch.cli;

import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.artifacts.RunSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: workforce runs
 * <p>
 * Lists stored runs, newest first: Run ID | Outcome | Input (truncated).
 */
@Command(name = "runs", mixinStandardHelpOptions = true, description = "List recent runs")
@Component
public class RunsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final ArtifactStore artifactStore;

    public RunsCommand(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<RunSummary> runs = artifactStore.listRuns(Math.max(limit, 1));
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found in " + artifactStore.baseDir());
            return;
        }

        ConsoleOutput.info("Runs (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-32s %-10s %s%n", "RUN ID", "OUTCOME", "INPUT");
        System.out.println("  " + "-".repeat(80));
        for (RunSummary run : runs) {
            System.out.printf("  %-32s %-10s %s%n", run.runId(), run.outcome(), ConsoleOutput.truncate(run.input(), 36));
        }
    }
}
