package com.autonomous.quota.service;

import com.autonomous.quota.exception.UpstreamException;
import com.autonomous.quota.model.ChatRequest;
import com.autonomous.quota.model.ChatResponse;

/**
 * The metered completion API the proxy forwards admitted requests to.
 */
public interface CompletionClient {

    ChatResponse complete(ChatRequest request, String apiKey) throws UpstreamException;
}
