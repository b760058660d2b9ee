package com.workforce.dispatch.cli;

import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.company.CompanyNotFoundException;
import com.workforce.core.company.SuggestedPrompt;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: workforce prompts [company]
 */
@Command(name = "prompts", mixinStandardHelpOptions = true, description = "List suggested prompts for a company")
@Component
public class PromptsCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Company id (default company if omitted)")
    private String companyId;

    private final CompanyDataLoader companies;

    public PromptsCommand(CompanyDataLoader companies) {
        this.companies = companies;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SuggestedPrompt> prompts;
        try {
            prompts = companies.suggestedPrompts(companyId);
        } catch (CompanyNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        for (SuggestedPrompt prompt : prompts) {
            System.out.println();
            String type = prompt.taskType() != null ? prompt.taskType().wireName() : "-";
            System.out.printf("  %s  [%s, %s]%n", prompt.label(), type, prompt.complexity());
            System.out.println("    " + prompt.prompt());
            if (!prompt.expectedFlow().isEmpty()) {
                System.out.println("    flow: " + String.join(" -> ", prompt.expectedFlow()));
            }
        }
    }
}
