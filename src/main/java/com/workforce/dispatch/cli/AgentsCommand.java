package com.workforce.dispatch.cli;

import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.company.CompanyNotFoundException;
import com.workforce.core.company.CompanyProfile;
import com.workforce.core.model.AgentNode;
import com.workforce.core.registry.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: workforce agents [company]
 * <p>
 * Prints the company's agent hierarchy as an indented tree, starting at the orchestrator.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "Show a company's agent hierarchy")
@Component
public class AgentsCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Company id (default company if omitted)")
    private String companyId;

    private final CompanyDataLoader companies;

    public AgentsCommand(CompanyDataLoader companies) {
        this.companies = companies;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        CompanyProfile company;
        try {
            company = companies.load(companyId);
        } catch (CompanyNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        ConsoleOutput.info(company.name() + " (" + company.registry().size() + " agents)");
        System.out.println();
        printNode(company.registry(), company.registry().orchestrator(), 0);
    }

    private static void printNode(AgentRegistry registry, AgentNode node, int depth) {
        String tools = node.tools().isEmpty() ? "" : "  tools: " + String.join(", ", node.tools());
        System.out.printf("  %s%-18s [%s]%s%n",
                "  ".repeat(depth), node.id(), node.role().displayName(), tools);
        for (AgentNode child : registry.childrenOf(node.id())) {
            printNode(registry, child, depth + 1);
        }
    }
}
