package com.autonomous.quota.service;

import com.autonomous.quota.exception.PriceCatalogLoadException;
import com.autonomous.quota.model.PriceEntry;
import com.autonomous.quota.model.PriceResolution;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Owns the price catalog and the model allow-list derived from it. Both are replaced together,
 * never mutated in place.
 */
@Slf4j
@Service
public class PriceCatalogService {

    @Value("${quota.pricing.path:classpath:model_pricing.csv}")
    private String pricingPath = "classpath:model_pricing.csv";

    @Value("${quota.default-pricing.input:30.0}")
    private double defaultInputRate = 30.0;

    @Value("${quota.default-pricing.output:60.0}")
    private double defaultOutputRate = 60.0;

    @Value("${quota.allowed-prefixes:}")
    private String[] allowedPrefixes = new String[0];

    private final ResourceLoader resourceLoader;
    private final PriceCatalogLoader loader = new PriceCatalogLoader();

    private volatile PriceCatalog catalog;
    private volatile ModelAllowList allowList;

    @Autowired
    public PriceCatalogService(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        replaceCatalog(Map.of());
    }

    public PriceCatalogService() {
        this(new DefaultResourceLoader());
    }

    public void setPricingPath(String path) {
        this.pricingPath = path;
    }

    public void setAllowedPrefixes(String... prefixes) {
        this.allowedPrefixes = prefixes;
    }

    @PostConstruct
    public void loadCatalog() {
        try {
            replaceCatalog(loader.load(resourceLoader.getResource(pricingPath)));
            log.info("Loaded pricing for {} models: {}", catalog.size(), catalog.getModelKeys());
        } catch (PriceCatalogLoadException e) {
            log.warn("Cannot load pricing file ({}): {}", pricingPath, e.getMessage());
            log.warn("Using default pricing for models");
            replaceCatalog(Map.of());
        }
        log.info("Allowed model prefixes: {}", allowList.getPrefixes());
    }

    public void replaceCatalog(Map<String, PriceEntry> entries) {
        PriceCatalog next = new PriceCatalog(entries, PriceEntry.defaultEntry(defaultInputRate, defaultOutputRate));
        this.allowList = ModelAllowList.of(allowedPrefixes, next.getModelKeys());
        this.catalog = next;
    }

    public PriceResolution resolve(String model) {
        return catalog.resolve(model);
    }

    public PriceCatalog getCatalog() {
        return catalog;
    }

    public ModelAllowList getAllowList() {
        return allowList;
    }
}
