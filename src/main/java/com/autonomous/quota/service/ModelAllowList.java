package com.autonomous.quota.service;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of model-family prefixes a request's model must start with.
 */
public class ModelAllowList {

    static final List<String> FALLBACK_PREFIXES =
        List.of("gpt-4o", "gpt-4-1106-preview", "gpt-4.1", "o3", "o4", "gpt-3.5");

    private final List<String> prefixes;

    public ModelAllowList(List<String> prefixes) {
        this.prefixes = prefixes.stream()
            .filter(prefix -> prefix != null && !prefix.isBlank())
            .map(String::trim)
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Configured prefixes win; otherwise the catalog keys are used, and the built-in list when the
     * catalog is empty.
     */
    public static ModelAllowList of(String[] configured, Collection<String> catalogKeys) {
        if (configured != null && Arrays.stream(configured).anyMatch(p -> p != null && !p.isBlank())) {
            return new ModelAllowList(Arrays.asList(configured));
        }
        if (catalogKeys != null && !catalogKeys.isEmpty()) {
            return new ModelAllowList(catalogKeys.stream().sorted().collect(Collectors.toList()));
        }
        return new ModelAllowList(FALLBACK_PREFIXES);
    }

    public boolean isAllowed(String model) {
        if (model == null || model.isEmpty()) {
            return false;
        }
        for (String prefix : prefixes) {
            if (model.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }
}
