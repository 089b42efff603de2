package com.example.signalrag.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnswerResponse {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_NO_DOCUMENTS = "no_documents";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_FILTERED = "filtered";

    private String answer;
    private List<Citation> citations;
    private String status;
    private String model;

    @JsonProperty("sources_used")
    private int sourcesUsed;
}
