package com.workforce.core.cost;

import java.util.Optional;

/**
 * Per-model price lookup. Implementations may read rates from anywhere.
 */
@FunctionalInterface
public interface RateTable {

    Optional<ModelRate> rateFor(String model);
}
