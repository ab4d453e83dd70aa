package com.quantpulsar.llm.analysis.cost;

import com.quantpulsar.llm.analysis.model.ModelPricing;

/**
 * Cost of one call. A {@code null} pricing means no catalog entry matched and the
 * zero cost carries no information.
 *
 * @param cost     monetary cost
 * @param currency currency code
 * @param pricing  matched catalog entry, or {@code null}
 */
public record CostEstimate(double cost, String currency, ModelPricing pricing) {

    static CostEstimate unpriced() {
        return new CostEstimate(0, ModelPricing.USD, null);
    }

    public boolean isPriced() {
        return pricing != null;
    }
}
