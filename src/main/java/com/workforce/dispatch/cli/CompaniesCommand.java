package com.workforce.dispatch.cli;

import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.company.CompanySummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: workforce companies
 */
@Command(name = "companies", mixinStandardHelpOptions = true, description = "List available companies")
@Component
public class CompaniesCommand implements Runnable {

    private final CompanyDataLoader companies;

    public CompaniesCommand(CompanyDataLoader companies) {
        this.companies = companies;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<CompanySummary> list = companies.listCompanies();
        if (list.isEmpty()) {
            ConsoleOutput.info("No companies found.");
            return;
        }

        System.out.printf("  %-20s %s%n", "ID", "NAME");
        System.out.println("  " + "-".repeat(50));
        for (CompanySummary company : list) {
            String marker = company.id().equals(companies.defaultCompanyId()) ? " (default)" : "";
            System.out.printf("  %-20s %s%s%n", company.id(), company.name(), marker);
        }
    }
}
