package com.example.signalrag.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class QueryRequest {

    @NotBlank
    @Size(min = 3, max = 1000)
    private String question;

    @Min(1)
    @Max(20)
    @JsonProperty("top_k")
    private int topK = 5;

    // absent means dense_lexical; unknown values are rejected by the controller
    @JsonProperty("search_mode")
    private String searchMode;

    @JsonProperty("generate_answer")
    private boolean generateAnswer;
}
