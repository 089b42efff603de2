package com.example.signalrag.domain.dto;

import com.example.signalrag.application.service.ScoredChunk;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {
    private String question;

    @JsonProperty("search_mode")
    private String searchMode;

    private List<ScoredChunk> results;

    @JsonProperty("total_results")
    private int totalResults;

    private AnswerResponse answer;
}
