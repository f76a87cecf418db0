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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatResponse {
    private String id;
    private String object;
    private long created;
    private String model;

    @Builder.Default
    private List<Choice> choices = new ArrayList<>();

    @Builder.Default
    private Usage usage = new Usage();

    @JsonProperty("proxy_usage")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ProxyUsage proxyUsage;
}
