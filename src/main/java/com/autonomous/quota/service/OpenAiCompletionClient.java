package com.autonomous.quota.service;

import com.autonomous.quota.exception.UpstreamException;
import com.autonomous.quota.model.ChatRequest;
import com.autonomous.quota.model.ChatResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Forwards chat completions to OpenAI using the caller's own API key. No retries.
 */
@Component
public class OpenAiCompletionClient implements CompletionClient {

    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public OpenAiCompletionClient(
            RestTemplate restTemplate,
            @Value("${quota.upstream.base-url:https://api.openai.com}") String baseUrl
    ) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public ChatResponse complete(ChatRequest request, String apiKey) throws UpstreamException {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<ChatResponse> response;
        try {
            response = restTemplate.exchange(
                baseUrl + COMPLETIONS_PATH, HttpMethod.POST, new HttpEntity<>(request, headers), ChatResponse.class);
        } catch (HttpStatusCodeException e) {
            throw new UpstreamException("OpenAI API error: " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new UpstreamException(e.getMessage(), e);
        }

        if (response.getBody() == null) {
            throw new UpstreamException("OpenAI API returned an empty response");
        }
        return response.getBody();
    }
}
