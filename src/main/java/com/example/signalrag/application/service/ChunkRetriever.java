package com.example.signalrag.application.service;

import com.example.signalrag.domain.model.SearchMode;
import java.util.List;

public interface ChunkRetriever {

    /**
     * Returns at most {@code topK} chunks, best first. An empty list means nothing matched.
     *
     * @throws com.example.signalrag.controller.exception.RetrievalFailedException if no signal of the mode
     *         could be queried
     */
    List<ScoredChunk> retrieve(String query, int topK, SearchMode mode);
}
