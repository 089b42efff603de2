package com.example.signalrag.controller.exception;

import com.example.signalrag.domain.model.RetrievalSignal;
import com.example.signalrag.domain.model.SearchMode;
import java.util.Set;
import org.springframework.http.HttpStatus;

/**
 * Every signal required by the search mode failed, so there is no result list to return.
 */
public class RetrievalFailedException extends BusinessException {

    private final SearchMode mode;
    private final Set<RetrievalSignal> failedSignals;

    public RetrievalFailedException(SearchMode mode, Set<RetrievalSignal> failedSignals, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE,
                "Retrieval failed for search_mode " + mode.wireName() + ": no signal succeeded " + failedSignals,
                cause);
        this.mode = mode;
        this.failedSignals = Set.copyOf(failedSignals);
    }

    public RetrievalFailedException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
        this.mode = null;
        this.failedSignals = Set.of();
    }

    public SearchMode getMode() {
        return mode;
    }

    public Set<RetrievalSignal> getFailedSignals() {
        return failedSignals;
    }
}
