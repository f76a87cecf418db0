package com.autonomous.quota.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Usage figures the proxy attaches to a successful response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyUsage {
    @JsonProperty("prompt_tokens")
    private int promptTokens;

    @JsonProperty("completion_tokens")
    private int completionTokens;

    @JsonProperty("cost_usd")
    private double costUsd;
}
