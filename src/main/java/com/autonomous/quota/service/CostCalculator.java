package com.autonomous.quota.service;

import com.autonomous.quota.model.PriceEntry;
import com.autonomous.quota.model.PriceResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class CostCalculator {

    private static final double TOKENS_PER_PRICE_UNIT = 1_000_000.0;

    private final PriceCatalogService catalogService;

    public CostCalculator(PriceCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * Rates are per one million tokens.
     */
    public static double cost(long promptTokens, long completionTokens, PriceEntry entry) {
        double inputCost = promptTokens * entry.getInputRate() / TOKENS_PER_PRICE_UNIT;
        double outputCost = completionTokens * entry.getOutputRate() / TOKENS_PER_PRICE_UNIT;
        return inputCost + outputCost;
    }

    public double calculateCost(long promptTokens, long completionTokens, String model) {
        PriceResolution resolution = catalogService.resolve(model);
        if (!resolution.isMatched()) {
            log.warn("Pricing not found for model {}, using defaults", model);
        }
        return cost(promptTokens, completionTokens, resolution.getEntry());
    }
}
