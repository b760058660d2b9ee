package com.workforce.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: companies, agents, prompts, chat, runs, run, serve.
 */
@Command(
        name = "workforce",
        mixinStandardHelpOptions = true,
        version = "Workforce 0.1.0",
        description = "Runs goals through a company's hierarchy of AI agents",
        subcommands = {
                CompaniesCommand.class,
                AgentsCommand.class,
                PromptsCommand.class,
                ChatCommand.class,
                RunsCommand.class,
                ShowRunCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WorkforceCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
