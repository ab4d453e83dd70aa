package com.quantpulsar.llm.analysis.model;

/**
 * Price catalog entry. Prices are per 1,000,000 tokens.
 *
 * @param provider         provider name, e.g. {@code openai}
 * @param model            model name as published by the provider
 * @param inputTokenPrice  price per million input tokens
 * @param outputTokenPrice price per million output tokens
 * @param currency         ISO currency code
 */
public record ModelPricing(
        String provider,
        String model,
        double inputTokenPrice,
        double outputTokenPrice,
        String currency) {

    public static final String USD = "USD";

    public static ModelPricing usd(String provider, String model, double inputTokenPrice, double outputTokenPrice) {
        return new ModelPricing(provider, model, inputTokenPrice, outputTokenPrice, USD);
    }
}
