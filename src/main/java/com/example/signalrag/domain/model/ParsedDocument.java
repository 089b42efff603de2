package com.example.signalrag.domain.model;

/**
 * Output of text extraction for one source document. Only successful extractions are chunked.
 */
public record ParsedDocument(
        String documentId,
        String filename,
        String sourceUrl,
        String text,
        int charCount,
        boolean extractionSuccess
) {

    public static ParsedDocument of(String documentId, String filename, String sourceUrl, String text) {
        String t = text == null ? "" : text;
        return new ParsedDocument(documentId, filename, sourceUrl, t, t.length(), true);
    }

    public static ParsedDocument failed(String documentId, String filename, String sourceUrl) {
        return new ParsedDocument(documentId, filename, sourceUrl, "", 0, false);
    }

    public boolean indexable() {
        return extractionSuccess && documentId != null && !documentId.isBlank()
                && text != null && !text.isBlank();
    }
}
