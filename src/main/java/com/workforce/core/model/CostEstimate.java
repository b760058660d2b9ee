package com.workforce.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Estimated currency cost of a run's token usage.
 *
 * @param model                  model id the rate was looked up for
 * @param totalEstimatedUsdCost  estimated cost in USD; null when no rate could be applied
 */
public record CostEstimate(
    String model,
    @JsonProperty("total_estimated_usd_cost") Double totalEstimatedUsdCost
) implements Serializable {}
