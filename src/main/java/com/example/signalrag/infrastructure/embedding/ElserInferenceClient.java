package com.example.signalrag.infrastructure.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Calls a deployed Elasticsearch trained model ({@code _ml/trained_models/{id}/_infer}) that produces
 * text-expansion tokens, ELSER by default.
 */
@Component
public class ElserInferenceClient implements ExpansionModelClient {

    private static final Logger log = LoggerFactory.getLogger(ElserInferenceClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String modelId;
    private final String inputField;
    private final String timeout;

    public ElserInferenceClient(
            RestClient restClient,
            ObjectMapper objectMapper,
            @Value("${signalrag.embedding.sparse.model-id}") String modelId,
            @Value("${signalrag.embedding.sparse.input-field:text_field}") String inputField,
            @Value("${signalrag.embedding.sparse.timeout:30s}") String timeout
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.modelId = modelId;
        this.inputField = inputField;
        this.timeout = timeout;
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public List<Map<String, Float>> infer(List<String> texts) throws IOException {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<Map<String, String>> docs = new ArrayList<>(texts.size());
        for (String text : texts) {
            docs.add(Map.of(inputField, text == null ? "" : text));
        }

        Request request = new Request("POST", "/_ml/trained_models/" + modelId + "/_infer");
        request.addParameter("timeout", timeout);
        request.setJsonEntity(objectMapper.writeValueAsString(Map.of("docs", docs)));

        long t0 = System.nanoTime();
        Response response = restClient.performRequest(request);
        JsonNode root;
        try (InputStream body = response.getEntity().getContent()) {
            root = objectMapper.readTree(body);
        }

        JsonNode results = root.path("inference_results");
        if (!results.isArray()) {
            throw new IOException("Inference response missing inference_results for model " + modelId);
        }
        List<Map<String, Float>> out = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            out.add(parseTokens(result));
        }
        log.debug("event=elser_infer_ok modelId={} docs={} ms={}",
                modelId, texts.size(), (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    // ELSER v2 answers {"predicted_value": {token: weight}}; older deployments nest it under text_expansion.tokens
    static Map<String, Float> parseTokens(JsonNode result) {
        if (result.hasNonNull("error")) {
            return null;
        }
        JsonNode predicted = result.path("predicted_value");
        if (predicted.has("text_expansion")) {
            JsonNode expansion = predicted.path("text_expansion");
            predicted = expansion.has("tokens") ? expansion.path("tokens") : expansion;
        }
        if (!predicted.isObject()) {
            return null;
        }
        Map<String, Float> tokens = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = predicted.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            if (e.getValue().isNumber()) {
                tokens.put(e.getKey(), e.getValue().floatValue());
            }
        }
        return tokens;
    }
}
