package com.workforce.core.cost;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Model prices bound from {@code workforce.pricing.*}. Also serves as the default {@link RateTable}.
 */
@Component
@ConfigurationProperties(prefix = "workforce.pricing")
public class PricingProperties implements RateTable {

    private String defaultModel = "gpt-4.1";
    private Map<String, ModelRate> rates = defaultRates();

    static Map<String, ModelRate> defaultRates() {
        Map<String, ModelRate> defaults = new LinkedHashMap<>();
        defaults.put("gpt-4.1", new ModelRate(2.00, 8.00));
        defaults.put("gpt-4.1-mini", new ModelRate(0.40, 1.60));
        defaults.put("gpt-4.1-nano", new ModelRate(0.10, 0.40));
        defaults.put("gpt-4o", new ModelRate(2.50, 10.00));
        defaults.put("gpt-4o-mini", new ModelRate(0.15, 0.60));
        return defaults;
    }

    @Override
    public Optional<ModelRate> rateFor(String model) {
        return model != null ? Optional.ofNullable(rates.get(model)) : Optional.empty();
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public Map<String, ModelRate> getRates() {
        return rates;
    }

    public void setRates(Map<String, ModelRate> rates) {
        this.rates = rates;
    }
}
