package com.autonomous.quota.service;

import com.autonomous.quota.model.PriceEntry;
import com.autonomous.quota.model.PriceResolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable model-key to price mapping with exact-then-prefix resolution.
 *
 * <p>Prefix resolution returns the first key found that is a prefix of the requested model.
 * Iteration order is unspecified, so when several keys are prefixes of the same model any of
 * them may win.
 */
public class PriceCatalog {

    private final Map<String, PriceEntry> entries;
    private final PriceEntry defaultEntry;

    public PriceCatalog(Map<String, PriceEntry> entries, PriceEntry defaultEntry) {
        this.entries = Map.copyOf(entries);
        this.defaultEntry = defaultEntry;
    }

    public static PriceCatalog empty(PriceEntry defaultEntry) {
        return new PriceCatalog(Map.of(), defaultEntry);
    }

    public PriceResolution resolve(String model) {
        if (model != null) {
            PriceEntry exact = entries.get(model);
            if (exact != null) {
                return new PriceResolution(exact, true);
            }
            for (Map.Entry<String, PriceEntry> candidate : entries.entrySet()) {
                if (model.startsWith(candidate.getKey())) {
                    return new PriceResolution(candidate.getValue(), true);
                }
            }
        }
        return new PriceResolution(defaultEntry, false);
    }

    public Map<String, PriceEntry> getEntries() {
        return entries;
    }

    public List<String> getModelKeys() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
