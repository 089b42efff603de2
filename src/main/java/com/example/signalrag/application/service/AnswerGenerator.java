package com.example.signalrag.application.service;

import com.example.signalrag.domain.dto.AnswerResponse;
import com.example.signalrag.domain.dto.Citation;
import com.example.signalrag.infrastructure.llm.LlmClient;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds a grounded prompt from the top retrieved chunks and turns the LLM reply into an answer with
 * citations. LLM failures are reported in the response status instead of being thrown.
 */
@Service
public class AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);

    static final int MAX_CONTEXTS = 5;
    static final int EXCERPT_CHARS = 200;

    static final String NOT_ENOUGH_INFORMATION = "I don't have enough information to answer that question.";
    static final String NO_DOCUMENTS_ANSWER =
            "I don't have enough information to answer that question as no relevant documents were retrieved.";
    static final String ERROR_ANSWER = "I'm sorry, there was an error generating an answer to your question.";

    private static final List<String> ANSWER_PREFIXES = List.of("Answer:", "ANSWER:", "A:", "Response:");

    private final LlmClient llmClient;
    private final ContentSafetyGuard safetyGuard;

    public AnswerGenerator(LlmClient llmClient, ContentSafetyGuard safetyGuard) {
        this.llmClient = llmClient;
        this.safetyGuard = safetyGuard;
    }

    public AnswerResponse generate(String question, List<ScoredChunk> contexts) {
        if (contexts == null || contexts.isEmpty()) {
            return AnswerResponse.builder()
                    .answer(NO_DOCUMENTS_ANSWER)
                    .citations(List.of())
                    .status(AnswerResponse.STATUS_NO_DOCUMENTS)
                    .model(llmClient.model())
                    .sourcesUsed(0)
                    .build();
        }

        List<Citation> citations = citations(contexts);
        if (!llmClient.configured()) {
            log.warn("event=answer_skipped reason=llm_not_configured contexts={}", citations.size());
            return error(citations, contexts.size());
        }

        long t0 = System.nanoTime();
        try {
            String raw = llmClient.complete(buildPrompt(question, contexts));
            String answer = cleanAnswer(raw);

            ContentSafetyGuard.SafetyCheck safety = safetyGuard.check(answer);
            if (!safety.safe()) {
                log.warn("event=answer_filtered matched={} risk={}", safety.matched(), safety.riskLevel());
                return AnswerResponse.builder()
                        .answer(ContentSafetyGuard.FILTERED_ANSWER)
                        .citations(citations)
                        .status(AnswerResponse.STATUS_FILTERED)
                        .model(llmClient.model())
                        .sourcesUsed(contexts.size())
                        .build();
            }

            log.info("event=answer_generated contexts={} chars_out={} ms={}",
                    citations.size(), answer.length(), (System.nanoTime() - t0) / 1_000_000);
            return AnswerResponse.builder()
                    .answer(answer)
                    .citations(citations)
                    .status(AnswerResponse.STATUS_SUCCESS)
                    .model(llmClient.model())
                    .sourcesUsed(contexts.size())
                    .build();
        } catch (RuntimeException e) {
            log.error("event=answer_failed contexts={} err={}", citations.size(), e.toString(), e);
            return error(citations, contexts.size());
        }
    }

    private AnswerResponse error(List<Citation> citations, int sourcesUsed) {
        return AnswerResponse.builder()
                .answer(ERROR_ANSWER)
                .citations(citations)
                .status(AnswerResponse.STATUS_ERROR)
                .model(llmClient.model())
                .sourcesUsed(sourcesUsed)
                .build();
    }

    static String buildPrompt(String question, List<ScoredChunk> contexts) {
        List<String> blocks = new ArrayList<>();
        List<ScoredChunk> top = contexts.subList(0, Math.min(MAX_CONTEXTS, contexts.size()));
        for (int i = 0; i < top.size(); i++) {
            ScoredChunk c = top.get(i);
            String filename = c.filename() == null || c.filename().isBlank() ? "N/A" : c.filename();
            blocks.add("Document " + (i + 1) + " (" + filename + "):\n" + (c.content() == null ? "" : c.content()));
        }

        return "Based on the following documents, answer the question clearly and concisely. "
                + "If the information is not available in the documents, say \"" + NOT_ENOUGH_INFORMATION + "\"\n\n"
                + "DOCUMENTS:\n" + String.join("\n\n", blocks) + "\n\n"
                + "QUESTION: " + question + "\n\n"
                + "ANSWER:";
    }

    static String cleanAnswer(String raw) {
        String answer = raw == null ? "" : raw.trim();
        if (answer.isEmpty()) {
            return NOT_ENOUGH_INFORMATION;
        }
        for (String prefix : ANSWER_PREFIXES) {
            if (answer.startsWith(prefix)) {
                answer = answer.substring(prefix.length()).trim();
            }
        }
        return answer;
    }

    static List<Citation> citations(List<ScoredChunk> contexts) {
        List<Citation> out = new ArrayList<>();
        for (int i = 0; i < Math.min(MAX_CONTEXTS, contexts.size()); i++) {
            ScoredChunk c = contexts.get(i);
            String content = c.content() == null ? "" : c.content();
            String excerpt = content.length() > EXCERPT_CHARS ? content.substring(0, EXCERPT_CHARS) + "..." : content;
            out.add(new Citation(
                    i + 1,
                    c.filename(),
                    c.chunkId(),
                    excerpt,
                    BigDecimal.valueOf(c.score()).setScale(4, RoundingMode.HALF_UP).doubleValue(),
                    c.sourceUrl()
            ));
        }
        return out;
    }
}
