package com.example.signalrag.controller.exception;

import com.example.signalrag.domain.model.SearchMode;
import org.springframework.http.HttpStatus;

public class InvalidSearchModeException extends BusinessException {

    public InvalidSearchModeException(String value) {
        super(HttpStatus.BAD_REQUEST,
                "Unknown search_mode '" + value + "', expected one of: " + SearchMode.allowedValues());
    }
}
