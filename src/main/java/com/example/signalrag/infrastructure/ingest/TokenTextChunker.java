package com.example.signalrag.infrastructure.ingest;

import com.example.signalrag.domain.model.Chunk;
import com.example.signalrag.domain.model.ParsedDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class TokenTextChunker {

    private static final Logger log = LoggerFactory.getLogger(TokenTextChunker.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int chunkTokens;
    private final int overlapTokens;
    private final int minChars;

    public TokenTextChunker(
            @Value("${signalrag.rag.chunk.tokens}") int chunkTokens,
            @Value("${signalrag.rag.chunk.overlap}") int overlapTokens,
            @Value("${signalrag.rag.chunk.min-chars}") int minChars
    ) {
        if (chunkTokens <= 0) {
            throw new IllegalArgumentException("chunkTokens must be > 0");
        }
        if (overlapTokens < 0 || overlapTokens >= chunkTokens) {
            throw new IllegalArgumentException("overlapTokens must be >= 0 and < chunkTokens");
        }
        this.chunkTokens = chunkTokens;
        this.overlapTokens = overlapTokens;
        this.minChars = Math.max(0, minChars);
    }

    /**
     * Chunks one extracted document. Chunk ids are assigned 0..n-1 in text order, so re-chunking the
     * same text yields the same composite keys.
     */
    public List<Chunk> chunk(ParsedDocument document) {
        List<String> texts = chunkText(document.text());
        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            chunks.add(new Chunk(
                    i,
                    document.documentId(),
                    document.filename() == null ? "" : document.filename(),
                    document.sourceUrl() == null ? "" : document.sourceUrl(),
                    text,
                    countTokens(text),
                    text.length()
            ));
        }
        log.info("event=document_chunked documentId={} chars={} chunks={}",
                document.documentId(), document.charCount(), chunks.size());
        return chunks;
    }

    /**
     * Token-based chunking (approximation): tokens ~= whitespace-separated terms.
     * Overlap is applied as sliding window; a short tail is merged into the previous chunk.
     */
    public List<String> chunkText(String text) {
        String cleaned = text == null ? "" : text.trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }

        String[] tokens = WHITESPACE.split(cleaned);
        List<String> chunks = new ArrayList<>();

        int start = 0;
        while (start < tokens.length) {
            int end = Math.min(tokens.length, start + chunkTokens);
            String chunk = String.join(" ", List.of(tokens).subList(start, end));

            if (chunk.length() >= minChars || chunks.isEmpty()) {
                chunks.add(chunk);
            } else if (chunks.get(chunks.size() - 1).length() < minChars * 2) {
                chunks.set(chunks.size() - 1, mergeTail(chunks.get(chunks.size() - 1), tokens, start, end));
            } else {
                chunks.add(chunk);
            }

            if (end >= tokens.length) {
                break;
            }
            start = end - overlapTokens;
        }

        return chunks;
    }

    static int countTokens(String text) {
        String t = text == null ? "" : text.trim();
        return t.isEmpty() ? 0 : WHITESPACE.split(t).length;
    }

    // the tail overlaps the previous chunk by overlapTokens, only the new tokens are appended
    private String mergeTail(String previous, String[] tokens, int start, int end) {
        int from = Math.min(end, start + overlapTokens);
        if (from >= end) {
            return previous;
        }
        return previous + " " + String.join(" ", List.of(tokens).subList(from, end));
    }
}
