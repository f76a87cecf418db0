package com.autonomous.quota.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat completion request as accepted from callers and forwarded upstream.
 * Optional parameters that were not supplied are left out of the forwarded body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatRequest {
    private String model;

    @Builder.Default
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private List<ChatMessage> messages = new ArrayList<>();

    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Integer n;
    private Object stop;

    @JsonProperty("presence_penalty")
    private Double presencePenalty;

    @JsonProperty("frequency_penalty")
    private Double frequencyPenalty;

    private Object functions;

    @JsonProperty("function_call")
    private Object functionCall;
}
