package com.autonomous.quota.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of the budget and the loaded catalog.
 */
@Value
@Builder
public class QuotaStatus {
    @JsonProperty("info")
    String info;

    @JsonProperty("cost_limit")
    double costLimit;

    @JsonProperty("current_cost")
    double currentCost;

    @JsonProperty("remaining")
    double remaining;

    @JsonProperty("available_models")
    List<String> availableModels;

    @JsonProperty("models_count")
    int modelsCount;
}
