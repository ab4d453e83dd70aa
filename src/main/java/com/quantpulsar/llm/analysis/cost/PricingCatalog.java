package com.quantpulsar.llm.analysis.cost;

import com.quantpulsar.llm.analysis.model.ModelPricing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable price table with fuzzy model lookup. Override entries are consulted
 * before the built-in defaults, so an override for a known model wins.
 * <p>
 * Model names are compared after normalization (lowercase, hyphens, underscores and
 * whitespace removed). Lookup order, first hit wins:
 * <ol>
 *     <li>exact normalized name, with matching provider when one is given</li>
 *     <li>substring match in either direction with matching provider, when one is given</li>
 *     <li>substring match in either direction, any provider</li>
 * </ol>
 *
 * @author Quantpulsar 2025-2026
 */
public final class PricingCatalog {

    public static final List<ModelPricing> DEFAULT_PRICING = List.of(
            // OpenAI
            ModelPricing.usd("openai", "gpt-4-turbo", 10, 30),
            ModelPricing.usd("openai", "gpt-4", 30, 60),
            ModelPricing.usd("openai", "gpt-4o", 5, 15),
            ModelPricing.usd("openai", "gpt-3.5-turbo", 0.5, 1.5),
            // Anthropic
            ModelPricing.usd("anthropic", "claude-3-opus", 15, 75),
            ModelPricing.usd("anthropic", "claude-3-sonnet", 3, 15),
            ModelPricing.usd("anthropic", "claude-3-haiku", 0.25, 1.25),
            ModelPricing.usd("anthropic", "claude-3.5-sonnet", 3, 15),
            // AWS Bedrock / Cohere
            ModelPricing.usd("aws.bedrock", "anthropic.claude-3-sonnet", 3, 15),
            ModelPricing.usd("cohere", "command-r-plus", 3, 15),
            // OCI GenAI
            ModelPricing.usd("oci.genai", "cohere.command-r-plus", 3, 15));

    private static final Pattern IGNORED_CHARACTERS = Pattern.compile("[-_\\s]");

    private static final PricingCatalog DEFAULTS = new PricingCatalog(List.of());

    private final List<ModelPricing> overrides;
    private final List<ModelPricing> entries;

    private PricingCatalog(List<ModelPricing> overrides) {
        this.overrides = List.copyOf(overrides);
        List<ModelPricing> all = new ArrayList<>(overrides.size() + DEFAULT_PRICING.size());
        all.addAll(overrides);
        all.addAll(DEFAULT_PRICING);
        this.entries = List.copyOf(all);
    }

    public static PricingCatalog defaults() {
        return DEFAULTS;
    }

    /** A catalog whose entries are {@code overrides} followed by the defaults. */
    public static PricingCatalog withOverrides(List<ModelPricing> overrides) {
        return overrides == null || overrides.isEmpty() ? DEFAULTS : new PricingCatalog(overrides);
    }

    public List<ModelPricing> getOverrides() {
        return overrides;
    }

    /** Every entry in lookup priority order. */
    public List<ModelPricing> entries() {
        return entries;
    }

    public Optional<ModelPricing> find(String model) {
        return find(model, null);
    }

    public Optional<ModelPricing> find(String model, String provider) {
        String normalized = normalize(model);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        boolean hasProvider = provider != null && !provider.isBlank();

        for (ModelPricing pricing : entries) {
            if (normalize(pricing.model()).equals(normalized)
                    && (!hasProvider || sameProvider(pricing, provider))) {
                return Optional.of(pricing);
            }
        }
        if (hasProvider) {
            for (ModelPricing pricing : entries) {
                if (sameProvider(pricing, provider) && overlaps(normalize(pricing.model()), normalized)) {
                    return Optional.of(pricing);
                }
            }
        }
        for (ModelPricing pricing : entries) {
            if (overlaps(normalize(pricing.model()), normalized)) {
                return Optional.of(pricing);
            }
        }
        return Optional.empty();
    }

    static String normalize(String model) {
        if (model == null) {
            return "";
        }
        return IGNORED_CHARACTERS.matcher(model.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private static boolean overlaps(String catalogModel, String model) {
        return !catalogModel.isEmpty() && (model.contains(catalogModel) || catalogModel.contains(model));
    }

    private static boolean sameProvider(ModelPricing pricing, String provider) {
        return pricing.provider() != null && pricing.provider().equalsIgnoreCase(provider);
    }
}
