package com.quantpulsar.llm.analysis.cost;

import com.quantpulsar.llm.analysis.model.ModelPricing;

import java.util.Locale;

/** Display formatting for costs and token counts. */
public final class CostFormatter {

    private CostFormatter() {
    }

    public static String formatCost(double cost) {
        return formatCost(cost, ModelPricing.USD);
    }

    /**
     * Formats with precision growing as the amount shrinks: 2 decimals from 1, 3 from 0.10,
     * 4 from 0.01, else 6. Exactly zero is {@code "N/A"}.
     */
    public static String formatCost(double cost, String currency) {
        if (cost == 0) {
            return "N/A";
        }
        int decimals = cost < 0.01 ? 6 : cost < 0.10 ? 4 : cost < 1 ? 3 : 2;
        String amount = String.format(Locale.ROOT, "%." + decimals + "f", cost);
        return currency == null || ModelPricing.USD.equalsIgnoreCase(currency)
                ? "$" + amount
                : currency + " " + amount;
    }

    /** Formats a token count with a K or M suffix above a thousand. */
    public static String formatTokens(long tokens) {
        if (tokens >= 1_000_000) {
            return String.format(Locale.ROOT, "%.1fM", tokens / 1_000_000.0);
        }
        if (tokens >= 1_000) {
            return String.format(Locale.ROOT, "%.1fK", tokens / 1_000.0);
        }
        return Long.toString(tokens);
    }
}
