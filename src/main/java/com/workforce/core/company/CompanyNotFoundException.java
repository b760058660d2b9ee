package com.workforce.core.company;

/**
 * No company data exists for the requested id.
 */
public class CompanyNotFoundException extends RuntimeException {

    private final String companyId;

    public CompanyNotFoundException(String companyId) {
        super("Company '" + companyId + "' not found");
        this.companyId = companyId;
    }

    public String getCompanyId() {
        return companyId;
    }
}
