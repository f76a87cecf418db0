package com.autonomous.quota.service;

import com.autonomous.quota.model.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JtokkitTokenCounterTest {

    private final TokenCounter tokenCounter = new JtokkitTokenCounter();

    @Test
    void shouldCountZeroForEmptyText() {
        assertEquals(0, tokenCounter.countTokens("", "gpt-4o"));
        assertEquals(0, tokenCounter.countTokens(null, "gpt-4o"));
    }

    @Test
    void shouldCountMoreTokensForLongerText() {
        int shortTokens = tokenCounter.countTokens("Hi", "gpt-4o");
        int longTokens = tokenCounter.countTokens("This is a much longer text that should have more tokens", "gpt-4o");

        assertTrue(shortTokens > 0);
        assertTrue(longTokens > shortTokens);
    }

    @Test
    void shouldFallBackForUnknownModel() {
        assertTrue(tokenCounter.countTokens("Hello world", "unknown-model-12345") > 0);
        assertTrue(tokenCounter.countTokens("Hello world", null) > 0);
    }

    @Test
    void shouldHandleUnicodeAndJson() {
        assertTrue(tokenCounter.countTokens("🚀🔥💻", "gpt-4o") > 0);
        assertTrue(tokenCounter.countTokens("{\"json\": \"test\", \"number\": 123}", "gpt-4o-mini") > 0);
    }

    @Test
    void shouldCountSpecialTokenMarkersAsText() {
        int withMarker = tokenCounter.countTokens("hi <|endoftext|> there", "gpt-4o");

        assertTrue(withMarker > tokenCounter.countTokens("hi  there", "gpt-4o"));
        assertTrue(tokenCounter.countTokens("<|endoftext|>", "gpt-3.5-turbo") > 0);
        assertTrue(tokenCounter.countTokens("<|fim_prefix|><|im_start|>", "unknown-model") > 0);
    }

    @Test
    void shouldBeDeterministic() {
        String text = "The same text always yields the same count.";

        assertEquals(tokenCounter.countTokens(text, "gpt-4o"), tokenCounter.countTokens(text, "gpt-4o"));
    }

    @Test
    void shouldAddPerMessageOverhead() {
        List<ChatMessage> messages = List.of(
            ChatMessage.builder().role("user").content("Hello").build(),
            ChatMessage.builder().role("assistant").content("Hi there!").build()
        );

        int expected = tokenCounter.countTokens("userHello", "gpt-4o")
            + tokenCounter.countTokens("assistantHi there!", "gpt-4o")
            + 3 * 2 + 3;

        assertEquals(expected, tokenCounter.countMessages(messages, "gpt-4o"));
        assertEquals(3, tokenCounter.countMessages(List.of(), "gpt-4o"));
    }
}
