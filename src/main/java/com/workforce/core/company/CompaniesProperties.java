package com.workforce.core.company;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "workforce.companies")
public class CompaniesProperties {

    /** Resource location holding one {@code <id>.json} per company. */
    private String location = "classpath:companies/";
    private String defaultCompany = "solaris";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getDefaultCompany() {
        return defaultCompany;
    }

    public void setDefaultCompany(String defaultCompany) {
        this.defaultCompany = defaultCompany;
    }
}
