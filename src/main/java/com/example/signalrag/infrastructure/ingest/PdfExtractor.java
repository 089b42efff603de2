package com.example.signalrag.infrastructure.ingest;

import com.example.signalrag.domain.model.ParsedDocument;
import java.io.IOException;
import java.io.InputStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PdfExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfExtractor.class);

    public String extractText(InputStream pdfStream) throws IOException {
        try (PDDocument document = PDDocument.load(pdfStream)) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            if (text == null) {
                return "";
            }
            return text.replace("\u0000", "").trim();
        }
    }

    /**
     * Extraction never throws: an unreadable PDF becomes a document with {@code extractionSuccess=false}.
     */
    public ParsedDocument parse(String documentId, String filename, String sourceUrl, InputStream pdfStream) {
        try {
            String text = extractText(pdfStream);
            if (text.isEmpty()) {
                log.warn("event=pdf_no_text documentId={} filename={}", documentId, filename);
                return ParsedDocument.failed(documentId, filename, sourceUrl);
            }
            log.info("event=pdf_extracted documentId={} filename={} chars={}", documentId, filename, text.length());
            return ParsedDocument.of(documentId, filename, sourceUrl, text);
        } catch (IOException e) {
            log.warn("event=pdf_extract_failed documentId={} filename={} err={}", documentId, filename, e.toString());
            return ParsedDocument.failed(documentId, filename, sourceUrl);
        }
    }
}
