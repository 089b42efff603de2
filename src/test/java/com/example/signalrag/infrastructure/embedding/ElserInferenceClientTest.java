package com.example.signalrag.infrastructure.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ElserInferenceClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesFlatPredictedValue() throws Exception {
        JsonNode node = mapper.readTree("{\"predicted_value\":{\"solar\":1.25,\"panel\":0.5}}");

        Map<String, Float> tokens = ElserInferenceClient.parseTokens(node);

        assertEquals(Map.of("solar", 1.25f, "panel", 0.5f), tokens);
    }

    @Test
    void parsesNestedTextExpansionTokens() throws Exception {
        JsonNode node = mapper.readTree(
                "{\"predicted_value\":{\"text_expansion\":{\"tokens\":{\"energy\":0.75}}}}");

        assertEquals(Map.of("energy", 0.75f), ElserInferenceClient.parseTokens(node));
    }

    @Test
    void errorResultYieldsNull() throws Exception {
        JsonNode node = mapper.readTree("{\"error\":\"model not allocated\"}");

        assertNull(ElserInferenceClient.parseTokens(node));
    }
}
