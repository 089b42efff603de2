package com.example.signalrag.infrastructure.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class LlmClientTest {

    private final LlmClient client = new LlmClient(new ObjectMapper(), "http://localhost:1", "", "test-model",
            0.1, 100, 100, 100);

    @Test
    void extractsFirstChoiceContent() {
        String body = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  Solar panels. \"}}]}";

        assertEquals("Solar panels.", client.extractContent(body));
    }

    @Test
    void missingChoicesIsAnError() {
        assertThrows(IllegalStateException.class, () -> client.extractContent("{\"choices\":[]}"));
    }

    @Test
    void missingApiKeyFailsFast() {
        assertFalse(client.configured());
        assertThrows(LlmNotConfiguredException.class, () -> client.complete("hello"));
    }

    @Test
    void apiKeyMakesClientConfigured() {
        LlmClient keyed = new LlmClient(new ObjectMapper(), "http://localhost:1", " sk-test ", "test-model",
                0.1, 100, 100, 100);

        assertTrue(keyed.configured());
    }
}
