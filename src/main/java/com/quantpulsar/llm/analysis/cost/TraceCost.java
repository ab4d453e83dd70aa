package com.quantpulsar.llm.analysis.cost;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cost of a whole trace.
 *
 * @param totalCost total cost
 * @param currency  currency code
 * @param breakdown cost per model; spans priced at the fallback rate are under {@link #ESTIMATED}
 * @param estimated whether any part of the total used the fallback rate
 */
public record TraceCost(double totalCost, String currency, Map<String, Double> breakdown, boolean estimated) {

    public static final String ESTIMATED = "estimated";

    public TraceCost {
        breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
