package com.workforce.dispatch.cli;

import com.workforce.core.company.CompanyNotFoundException;
import com.workforce.core.engine.WorkforceEngine;
import com.workforce.core.events.SessionEvent;
import com.workforce.core.model.TaskType;
import com.workforce.core.session.RunResult;
import com.workforce.core.session.SessionEventStream;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: workforce chat "&lt;goal&gt;"
 * <p>
 * Runs a goal through the company's workforce, printing handoffs and tool calls as they
 * happen. Exits non-zero if the run ends in error.
 */
@Command(name = "chat", mixinStandardHelpOptions = true, description = "Run a goal through the workforce")
@Component
public class ChatCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language goal")
    private String message;

    @Option(names = {"--company", "-c"}, description = "Company id (default company if omitted)")
    private String companyId;

    @Option(names = {"--task-type", "-t"},
            description = "Task type: content_creation, research, analysis, strategy (classified if omitted)")
    private String taskType;

    private final WorkforceEngine engine;

    public ChatCommand(WorkforceEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (message == null || message.isBlank()) {
            ConsoleOutput.error("Message is required");
            return 2;
        }

        TaskType type;
        try {
            type = taskType != null ? TaskType.fromString(taskType) : null;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid task type: " + taskType
                    + ". Valid types: content_creation, research, analysis, strategy");
            return 2;
        }

        SessionEventStream stream;
        try {
            stream = engine.runStream(companyId, message, type);
        } catch (CompanyNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        RunResult result;
        try (stream) {
            while (stream.hasNext()) {
                SessionEvent event = stream.next();
                ConsoleOutput.sessionEvent(event);
            }
            result = stream.result();
        }

        ConsoleOutput.usage(result.usage(), result.cost());
        return result.isCompleted() ? 0 : 1;
    }
}
