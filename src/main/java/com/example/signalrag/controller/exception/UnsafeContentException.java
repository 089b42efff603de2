package com.example.signalrag.controller.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

public class UnsafeContentException extends BusinessException {

    private final List<String> matched;

    public UnsafeContentException(List<String> matched) {
        super(HttpStatus.BAD_REQUEST, "Question rejected by content safety check");
        this.matched = matched;
    }

    public List<String> getMatched() {
        return matched;
    }
}
