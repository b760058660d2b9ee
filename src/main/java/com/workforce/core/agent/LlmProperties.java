package com.workforce.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "workforce.llm")
public class LlmProperties {

    private String model = "gpt-4.1";

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }
}
