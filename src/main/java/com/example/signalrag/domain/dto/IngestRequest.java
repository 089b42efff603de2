package com.example.signalrag.domain.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class IngestRequest {

    @NotNull
    private List<@NotNull @Valid DocumentPayload> documents;
}
