package com.workforce.core.cost;

import com.workforce.core.model.CostEstimate;
import com.workforce.core.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Converts a run's token usage into an estimated USD cost.
 * <p>
 * Models without a rate are priced at the default model's rate and reported under the default
 * model's name. When even the default has no rate the cost is null.
 */
@Service
public class CostEstimator {

    private static final Logger log = LoggerFactory.getLogger(CostEstimator.class);
    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

    private final RateTable rates;
    private final String defaultModel;

    @Autowired
    public CostEstimator(PricingProperties properties) {
        this(properties, properties.getDefaultModel());
    }

    public CostEstimator(RateTable rates, String defaultModel) {
        this.rates = rates;
        this.defaultModel = defaultModel;
    }

    public CostEstimate estimate(TokenUsage usage) {
        TokenUsage effective = usage != null ? usage : TokenUsage.empty();
        String model = effective.model() != null ? effective.model() : defaultModel;

        Optional<ModelRate> rate = rates.rateFor(model);
        if (rate.isEmpty()) {
            log.debug("No rate for model {}, using default {}", model, defaultModel);
            model = defaultModel;
            rate = rates.rateFor(defaultModel);
        }
        if (rate.isEmpty()) {
            log.warn("No rate configured for default model {}; cost unavailable", defaultModel);
            return new CostEstimate(model, null);
        }

        BigDecimal input = BigDecimal.valueOf(effective.inputTokens())
                .multiply(BigDecimal.valueOf(rate.get().getInput()));
        BigDecimal output = BigDecimal.valueOf(effective.outputTokens())
                .multiply(BigDecimal.valueOf(rate.get().getOutput()));
        BigDecimal total = input.add(output).divide(ONE_MILLION, 6, RoundingMode.HALF_UP);
        return new CostEstimate(model, total.doubleValue());
    }
}
