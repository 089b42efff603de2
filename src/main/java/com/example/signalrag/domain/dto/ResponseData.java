package com.example.signalrag.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class ResponseData<T> {
    private int status;
    private String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private T data;

    public static <T> ResponseData<T> ok(String message, T data) {
        return ResponseData.<T>builder()
                .status(200)
                .message(message)
                .data(data)
                .build();
    }
}
