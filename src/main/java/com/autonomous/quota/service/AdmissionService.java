package com.autonomous.quota.service;

import com.autonomous.quota.exception.AdmissionException;
import com.autonomous.quota.exception.RejectionReason;
import com.autonomous.quota.exception.UpstreamException;
import com.autonomous.quota.model.AdmissionState;
import com.autonomous.quota.model.ChatRequest;
import com.autonomous.quota.model.ChatResponse;
import com.autonomous.quota.model.Choice;
import com.autonomous.quota.model.LedgerSnapshot;
import com.autonomous.quota.model.QuotaStatus;
import com.autonomous.quota.model.RequestAccounting;
import com.autonomous.quota.model.Usage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs one completion request through the quota protocol: budget gate, credential check, model
 * allow-list, prompt-only estimate, admission, dispatch, reconciliation and commit.
 *
 * <p>The ledger is only charged after a successful upstream round trip. The upstream call runs
 * without holding the ledger lock.
 */
@Slf4j
@Service
public class AdmissionService {

    static final String BEARER_PREFIX = "Bearer ";

    private final BudgetLedger ledger;
    private final PriceCatalogService catalogService;
    private final CostCalculator costCalculator;
    private final TokenCounter tokenCounter;
    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    public AdmissionService(BudgetLedger ledger,
                            PriceCatalogService catalogService,
                            CostCalculator costCalculator,
                            TokenCounter tokenCounter,
                            CompletionClient completionClient,
                            ObjectMapper objectMapper) {
        this.ledger = ledger;
        this.catalogService = catalogService;
        this.costCalculator = costCalculator;
        this.tokenCounter = tokenCounter;
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Handles a raw request body. The body is only parsed once the caller is authorized.
     */
    public ChatResponse handle(String authorization, String body) {
        RequestAccounting accounting = new RequestAccounting();
        checkNotExhausted(accounting);
        String apiKey = authorize(authorization, accounting);
        ChatRequest request = parse(body, accounting);
        return process(apiKey, request, accounting);
    }

    public ChatResponse handle(String authorization, ChatRequest request) {
        RequestAccounting accounting = new RequestAccounting();
        checkNotExhausted(accounting);
        String apiKey = authorize(authorization, accounting);
        if (request == null) {
            throw reject(accounting, RejectionReason.MALFORMED_REQUEST, "Missing JSON data in request.");
        }
        return process(apiKey, request, accounting);
    }

    public QuotaStatus status() {
        LedgerSnapshot snapshot = ledger.snapshot();
        PriceCatalog catalog = catalogService.getCatalog();
        return QuotaStatus.builder()
            .info("Local OpenAI proxy. Available method: POST.")
            .costLimit(snapshot.getCeiling())
            .currentCost(snapshot.getTotalSpent())
            .remaining(snapshot.getRemaining())
            .availableModels(catalog.getModelKeys())
            .modelsCount(catalog.size())
            .build();
    }

    private ChatResponse process(String apiKey, ChatRequest request, RequestAccounting accounting) {
        String model = request.getModel();
        accounting.setModel(model);

        if (!catalogService.getAllowList().isAllowed(model)) {
            throw reject(accounting, RejectionReason.MODEL_NOT_ALLOWED,
                String.format("Model %s is not in the allowed list.", model));
        }

        int promptTokens = tokenCounter.countMessages(request.getMessages(), model);
        double estimatedCost = costCalculator.calculateCost(promptTokens, 0, model);
        accounting.setPromptTokens(promptTokens);
        accounting.setEstimatedCost(estimatedCost);

        Optional<RejectionReason> refusal = ledger.checkAdmission(estimatedCost);
        if (refusal.isPresent()) {
            LedgerSnapshot snapshot = ledger.snapshot();
            if (refusal.get() == RejectionReason.BUDGET_EXHAUSTED) {
                log.warn("Request blocked: quota limit exceeded, current_cost=${}, limit=${}",
                    usd(snapshot.getTotalSpent()), usd(snapshot.getCeiling()));
                throw reject(accounting, RejectionReason.BUDGET_EXHAUSTED, "Global cost limit exceeded.");
            }
            log.warn("Request blocked: prompt would exceed quota, prompt_tokens={}, prompt_cost=${}, current_cost=${}, limit=${}",
                promptTokens, usd(estimatedCost), usd(snapshot.getTotalSpent()), usd(snapshot.getCeiling()));
            throw reject(accounting, RejectionReason.BUDGET_WOULD_BE_EXCEEDED, "Request would exceed global cost limit.");
        }
        accounting.advance(AdmissionState.ADMITTED);

        ChatResponse response;
        try {
            response = completionClient.complete(request, apiKey);
        } catch (UpstreamException e) {
            LedgerSnapshot snapshot = ledger.snapshot();
            log.warn("Failed request: model={}, prompt_tokens={}, completion_tokens=0, estimated_cost=${}, total_cost=${}, remaining=${}, error={}",
                model, promptTokens, usd(estimatedCost), usd(snapshot.getTotalSpent()), usd(snapshot.getRemaining()), e.getMessage());
            accounting.reject(RejectionReason.UPSTREAM_FAILURE);
            throw new AdmissionException(RejectionReason.UPSTREAM_FAILURE,
                "OpenAI API call error: " + e.getMessage(), e);
        }
        accounting.advance(AdmissionState.DISPATCHED);

        reconcile(request, response, accounting);
        double totalSpent = ledger.commit(accounting.getFinalCost());
        accounting.advance(AdmissionState.RECONCILED);

        log.info("Request: model={}, prompt_tokens={}, completion_tokens={}, cost=${}, total_cost=${}, remaining=${}",
            model, accounting.getPromptTokens(), accounting.getCompletionTokens(), usd(accounting.getFinalCost()),
            usd(totalSpent), usd(ledger.getCeiling() - totalSpent));

        response.setProxyUsage(accounting.toProxyUsage());
        return response;
    }

    private void checkNotExhausted(RequestAccounting accounting) {
        if (ledger.isExhausted()) {
            log.warn("Request blocked: quota limit exceeded, current_cost=${}, limit=${}",
                usd(ledger.getTotalSpent()), usd(ledger.getCeiling()));
            throw reject(accounting, RejectionReason.BUDGET_EXHAUSTED, "Global cost limit exceeded.");
        }
    }

    private String authorize(String authorization, RequestAccounting accounting) {
        if (authorization == null || authorization.isEmpty()) {
            throw reject(accounting, RejectionReason.UNAUTHORIZED,
                "Missing Authorization header. Use: Authorization: Bearer your-api-key");
        }
        if (!authorization.startsWith(BEARER_PREFIX)) {
            throw reject(accounting, RejectionReason.UNAUTHORIZED,
                "Invalid Authorization header format. Use: Authorization: Bearer your-api-key");
        }
        String apiKey = authorization.substring(BEARER_PREFIX.length()).trim();
        if (apiKey.isEmpty()) {
            throw reject(accounting, RejectionReason.UNAUTHORIZED,
                "Empty API key. Use: Authorization: Bearer your-api-key");
        }
        accounting.advance(AdmissionState.AUTHORIZED);
        return apiKey;
    }

    private ChatRequest parse(String body, RequestAccounting accounting) {
        if (body == null || body.isBlank()) {
            throw reject(accounting, RejectionReason.MALFORMED_REQUEST, "Missing JSON data in request.");
        }
        try {
            ChatRequest request = objectMapper.readValue(body, ChatRequest.class);
            if (request == null) {
                throw reject(accounting, RejectionReason.MALFORMED_REQUEST, "Missing JSON data in request.");
            }
            return request;
        } catch (JsonProcessingException e) {
            log.debug("Unparsable request body: {}", e.getOriginalMessage());
            throw reject(accounting, RejectionReason.MALFORMED_REQUEST, "Missing JSON data in request.", e);
        }
    }

    /**
     * Usage reported upstream is preferred. When either count is missing both are recounted locally,
     * the completion from the concatenated text of all returned choices.
     */
    private void reconcile(ChatRequest request, ChatResponse response, RequestAccounting accounting) {
        String model = accounting.getModel();
        int promptTokens = accounting.getPromptTokens();
        int completionTokens = 0;

        Usage usage = response.getUsage();
        if (usage != null) {
            if (usage.getPromptTokens() > 0) {
                promptTokens = usage.getPromptTokens();
            }
            completionTokens = usage.getCompletionTokens();
        }

        if (promptTokens == 0 || completionTokens == 0) {
            promptTokens = tokenCounter.countMessages(request.getMessages(), model);
            completionTokens = tokenCounter.countTokens(completionText(response), model);
        }

        accounting.setPromptTokens(promptTokens);
        accounting.setCompletionTokens(completionTokens);
        accounting.setFinalCost(costCalculator.calculateCost(promptTokens, completionTokens, model));
    }

    private static String completionText(ChatResponse response) {
        StringBuilder text = new StringBuilder();
        if (response.getChoices() != null) {
            for (Choice choice : response.getChoices()) {
                if (choice.getMessage() != null && choice.getMessage().getContent() != null) {
                    text.append(choice.getMessage().getContent());
                }
            }
        }
        return text.toString();
    }

    private static AdmissionException reject(RequestAccounting accounting, RejectionReason reason, String message) {
        accounting.reject(reason);
        return new AdmissionException(reason, message);
    }

    private static AdmissionException reject(RequestAccounting accounting, RejectionReason reason, String message,
                                             Throwable cause) {
        accounting.reject(reason);
        return new AdmissionException(reason, message, cause);
    }

    private static String usd(double amount) {
        return String.format("%.6f", amount);
    }
}
