package com.workforce.dispatch.cli;

import com.workforce.core.artifacts.ArtifactReplayer;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.artifacts.ArtifactStoreException;
import com.workforce.core.artifacts.RunTrace;
import com.workforce.core.model.HandoffStep;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: workforce run &lt;run-id|prefix&gt;
 * <p>
 * Shows a stored run: outcome, handoff timeline and final response. Runs that never wrote
 * {@code trace.json} are rebuilt from their event log.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Show a stored run")
@Component
public class ShowRunCommand implements Runnable {

    @Parameters(index = "0", description = "Run id or unique prefix")
    private String runId;

    private final ArtifactStore artifactStore;
    private final ArtifactReplayer replayer;

    public ShowRunCommand(ArtifactStore artifactStore, ArtifactReplayer replayer) {
        this.artifactStore = artifactStore;
        this.replayer = replayer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<String> resolved;
        try {
            resolved = artifactStore.resolveRun(runId);
        } catch (ArtifactStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (resolved.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return;
        }
        String id = resolved.get();

        System.out.println();
        System.out.println("RUN " + id);
        System.out.println("──────────────────────────────────");
        System.out.println("  Input:      " + artifactStore.readInput(id).orElse("-"));

        Optional<RunTrace> traceOpt = artifactStore.readTrace(id);
        List<HandoffStep> handoffs;
        if (traceOpt.isPresent()) {
            RunTrace trace = traceOpt.get();
            System.out.println("  Company:    " + trace.companyId());
            System.out.println("  Task type:  " + (trace.taskType() != null ? trace.taskType().wireName() : "-"));
            System.out.println("  Outcome:    " + trace.outcome()
                    + (trace.evaluationOutcome() != null ? " / " + trace.evaluationOutcome() : ""));
            System.out.println("  Iteration:  " + trace.iteration() + " / " + trace.maxIterations());
            System.out.println("  Duration:   " + ConsoleOutput.formatDuration(trace.durationMs()));
            System.out.println("  Agents:     " + String.join(", ", trace.agentsInvolved()));
            if (trace.error() != null) {
                System.out.println("  Error:      " + trace.errorType() + ": " + trace.error());
            }
            ConsoleOutput.usage(trace.usage(), trace.cost());
            handoffs = trace.handoffs();
        } else {
            var replayed = replayer.replay(id);
            System.out.println("  Outcome:    " + replayed.terminal().orElse("unknown") + " (from event log)");
            replayed.error().ifPresent(error -> System.out.println("  Error:      " + error));
            handoffs = replayed.handoffs();
        }

        if (!handoffs.isEmpty()) {
            System.out.println();
            System.out.println("  HANDOFFS:");
            int step = 1;
            for (HandoffStep handoff : handoffs) {
                System.out.printf("    %2d. %-18s -> %-18s %-10s %s%n", step++,
                        handoff.from(), handoff.to(), handoff.kind().wireName(),
                        handoff.note() != null ? handoff.note() : "");
            }
        }

        artifactStore.readResponse(id).ifPresent(response -> {
            System.out.println();
            System.out.println("  RESPONSE:");
            System.out.println(response);
        });
    }
}
