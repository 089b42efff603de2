package com.example.signalrag.domain.dto;

import com.example.signalrag.domain.model.ParsedDocument;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An already extracted document as submitted to {@code POST /api/rag/ingest}.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class DocumentPayload {

    @NotBlank
    @JsonProperty("document_id")
    private String documentId;

    private String filename;

    @JsonProperty("source_url")
    private String sourceUrl;

    private String text;

    @JsonProperty("extraction_success")
    private boolean extractionSuccess = true;

    public ParsedDocument toParsedDocument() {
        if (!extractionSuccess) {
            return ParsedDocument.failed(documentId, filename, sourceUrl);
        }
        return ParsedDocument.of(documentId, filename, sourceUrl, text);
    }
}
