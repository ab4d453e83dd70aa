package com.quantpulsar.llm.analysis.cost;

import com.quantpulsar.llm.analysis.model.LlmSpanInfo;
import com.quantpulsar.llm.analysis.model.ModelPricing;
import com.quantpulsar.llm.analysis.model.TraceLlmSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Prices token usage against a {@link PricingCatalog}. Prices are per million tokens.
 * <p>
 * Single calls without a catalog match cost 0 with no pricing attached. Trace level
 * costs always produce a figure: usage that cannot be priced is charged at the
 * fallback rate and the result is flagged as estimated.
 *
 * @author Quantpulsar 2025-2026
 */
public class CostCalculator {

    private static final Logger log = LoggerFactory.getLogger(CostCalculator.class);

    private static final double TOKENS_PER_UNIT = 1_000_000.0;

    /** Rough average across common models, used when no concrete model is known. */
    public static final ModelPricing DEFAULT_FALLBACK = ModelPricing.usd("estimate", "average", 5, 15);

    private final PricingCatalog catalog;
    private final ModelPricing fallback;

    public CostCalculator() {
        this(PricingCatalog.defaults(), DEFAULT_FALLBACK);
    }

    public CostCalculator(PricingCatalog catalog) {
        this(catalog, DEFAULT_FALLBACK);
    }

    public CostCalculator(PricingCatalog catalog, ModelPricing fallback) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public PricingCatalog getCatalog() {
        return catalog;
    }

    public ModelPricing getFallback() {
        return fallback;
    }

    public Optional<ModelPricing> findModelPricing(String model, String provider) {
        return catalog.find(model, provider);
    }

    public CostEstimate calculateLlmCost(long inputTokens, long outputTokens, String model) {
        return calculateLlmCost(inputTokens, outputTokens, model, null);
    }

    public CostEstimate calculateLlmCost(long inputTokens, long outputTokens, String model, String provider) {
        Optional<ModelPricing> match = catalog.find(model, provider);
        if (match.isEmpty()) {
            log.debug("No pricing for model '{}' (provider '{}')", model, provider);
            return CostEstimate.unpriced();
        }
        ModelPricing pricing = match.get();
        return new CostEstimate(price(inputTokens, outputTokens, pricing), pricing.currency(), pricing);
    }

    /** Cost of one span; unpriced when it is not an LLM span or names no known model. */
    public SpanCost calculateSpanCost(LlmSpanInfo info) {
        if (info == null || !info.isLlmSpan() || info.getModel() == null) {
            return new SpanCost(0, ModelPricing.USD, null);
        }
        long input = orZero(info.getInputTokens());
        long output = orZero(info.getOutputTokens());
        CostEstimate estimate = calculateLlmCost(input, output, info.getModel(), info.getProvider());
        if (!estimate.isPriced()) {
            return new SpanCost(0, ModelPricing.USD, null);
        }
        ModelPricing pricing = estimate.pricing();
        return new SpanCost(estimate.cost(), estimate.currency(), new SpanCost.Breakdown(
                input / TOKENS_PER_UNIT * pricing.inputTokenPrice(),
                output / TOKENS_PER_UNIT * pricing.outputTokenPrice(),
                info.getModel()));
    }

    public TraceCost calculateTraceCost(TraceLlmSummary summary) {
        return calculateTraceCost(summary, null, null);
    }

    /**
     * Prices a trace's token totals at the primary model's rate, or at the fallback
     * rate when no primary model is given or it cannot be priced.
     */
    public TraceCost calculateTraceCost(TraceLlmSummary summary, String primaryModel, String provider) {
        if (primaryModel != null && !primaryModel.isBlank()) {
            CostEstimate estimate = calculateLlmCost(summary.totalInputTokens(), summary.totalOutputTokens(),
                    primaryModel, provider);
            if (estimate.isPriced()) {
                return new TraceCost(estimate.cost(), estimate.currency(),
                        Map.of(primaryModel, estimate.cost()), false);
            }
        }
        double cost = price(summary.totalInputTokens(), summary.totalOutputTokens(), fallback);
        return new TraceCost(cost, fallback.currency(), Map.of(TraceCost.ESTIMATED, cost), true);
    }

    /**
     * Sums per-span costs into a per-model breakdown. LLM spans whose model is missing
     * or unknown are charged at the fallback rate under {@link TraceCost#ESTIMATED}.
     */
    public TraceCost calculateTraceCost(Collection<LlmSpanInfo> spans) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double total = 0;
        String currency = null;
        boolean estimated = false;
        for (LlmSpanInfo info : spans) {
            if (!info.isLlmSpan()) {
                continue;
            }
            SpanCost spanCost = calculateSpanCost(info);
            String key;
            double cost;
            if (spanCost.breakdown() != null) {
                key = spanCost.breakdown().model();
                cost = spanCost.cost();
                if (currency == null) {
                    currency = spanCost.currency();
                }
            } else {
                key = TraceCost.ESTIMATED;
                cost = price(orZero(info.getInputTokens()), orZero(info.getOutputTokens()), fallback);
                estimated = true;
            }
            breakdown.merge(key, cost, Double::sum);
            total += cost;
        }
        return new TraceCost(total, currency != null ? currency : fallback.currency(), breakdown, estimated);
    }

    private static double price(long inputTokens, long outputTokens, ModelPricing pricing) {
        return inputTokens / TOKENS_PER_UNIT * pricing.inputTokenPrice()
                + outputTokens / TOKENS_PER_UNIT * pricing.outputTokenPrice();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
