package com.autonomous.quota.service;

import com.autonomous.quota.model.ChatMessage;

import java.util.List;

/**
 * Counts tokens for a model. Implementations must be deterministic and must always return a
 * count, falling back to a generic encoding when the model is unknown.
 */
public interface TokenCounter {

    int PER_MESSAGE_OVERHEAD = 3;
    int REPLY_PRIMING = 3;

    int countTokens(String text, String model);

    default int countMessages(List<ChatMessage> messages, String model) {
        if (messages == null || messages.isEmpty()) {
            return REPLY_PRIMING;
        }
        int total = 0;
        for (ChatMessage message : messages) {
            String text = nullToEmpty(message.getRole()) + nullToEmpty(message.getName()) + nullToEmpty(message.getContent());
            total += countTokens(text, model);
        }
        return total + PER_MESSAGE_OVERHEAD * messages.size() + REPLY_PRIMING;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
