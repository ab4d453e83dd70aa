package com.quantpulsar.llm.analysis.cost;

/**
 * Cost of one LLM span with its input/output split.
 *
 * @param cost      total cost
 * @param currency  currency code
 * @param breakdown split by direction, {@code null} when the span could not be priced
 */
public record SpanCost(double cost, String currency, Breakdown breakdown) {

    public record Breakdown(double inputCost, double outputCost, String model) {
    }
}
