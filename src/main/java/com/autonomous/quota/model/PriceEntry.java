package com.autonomous.quota.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Per-model price rates, in currency units per one million tokens.
 * An entry registered under a dated version key carries the generic model name.
 */
@Value
@Builder
public class PriceEntry {

    public static final String DEFAULT_MODEL = "default";

    @JsonProperty("model")
    String model;

    @JsonProperty("version")
    String version;

    @JsonProperty("input")
    double inputRate;

    @JsonProperty("cached_input")
    double cachedInputRate;

    @JsonProperty("output")
    double outputRate;

    public static PriceEntry defaultEntry(double inputRate, double outputRate) {
        return PriceEntry.builder()
            .model(DEFAULT_MODEL)
            .version("")
            .inputRate(inputRate)
            .outputRate(outputRate)
            .build();
    }
}
