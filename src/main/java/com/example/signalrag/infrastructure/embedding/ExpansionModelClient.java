package com.example.signalrag.infrastructure.embedding;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Remote learned term-expansion model.
 */
public interface ExpansionModelClient {

    /**
     * Runs inference for all texts in a single request.
     *
     * @return one token-weight map per input text, in input order
     * @throws IOException if the model cannot be reached or answers with an error
     */
    List<Map<String, Float>> infer(List<String> texts) throws IOException;

    String modelId();
}
