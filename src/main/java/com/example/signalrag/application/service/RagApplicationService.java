package com.example.signalrag.application.service;

import com.example.signalrag.controller.exception.BusinessException;
import com.example.signalrag.controller.exception.UnsafeContentException;
import com.example.signalrag.domain.dto.AnswerResponse;
import com.example.signalrag.domain.dto.DocumentPayload;
import com.example.signalrag.domain.dto.QueryResponse;
import com.example.signalrag.domain.model.ParsedDocument;
import com.example.signalrag.domain.model.SearchMode;
import com.example.signalrag.infrastructure.embedding.DenseEmbeddingGenerator;
import com.example.signalrag.infrastructure.embedding.SparseExpansionGenerator;
import com.example.signalrag.infrastructure.ingest.IngestResult;
import com.example.signalrag.infrastructure.ingest.IngestService;
import com.example.signalrag.infrastructure.ingest.PdfExtractor;
import com.example.signalrag.infrastructure.search.ChunkStore;
import com.example.signalrag.infrastructure.search.ChunkStoreException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Use cases behind the HTTP API:
 * query -> cached hybrid retrieval -> optional answer generation, and
 * documents or PDF upload -> ingest pipeline.
 */
@Service
public class RagApplicationService {

    private static final Logger log = LoggerFactory.getLogger(RagApplicationService.class);

    private final CachedRetriever retriever;
    private final AnswerGenerator answerGenerator;
    private final IngestService ingestService;
    private final PdfExtractor pdfExtractor;
    private final ChunkStore store;
    private final DenseEmbeddingGenerator denseGenerator;
    private final SparseExpansionGenerator sparseGenerator;
    private final ContentSafetyGuard safetyGuard;

    public RagApplicationService(
            CachedRetriever retriever,
            AnswerGenerator answerGenerator,
            ContentSafetyGuard safetyGuard,
            IngestService ingestService,
            PdfExtractor pdfExtractor,
            ChunkStore store,
            DenseEmbeddingGenerator denseGenerator,
            SparseExpansionGenerator sparseGenerator
    ) {
        this.retriever = retriever;
        this.answerGenerator = answerGenerator;
        this.safetyGuard = safetyGuard;
        this.ingestService = ingestService;
        this.pdfExtractor = pdfExtractor;
        this.store = store;
        this.denseGenerator = denseGenerator;
        this.sparseGenerator = sparseGenerator;
    }

    public QueryResponse query(String question, int topK, SearchMode mode, boolean generateAnswer) {
        long t0 = System.nanoTime();

        ContentSafetyGuard.SafetyCheck safety = safetyGuard.check(question);
        if (!safety.safe()) {
            log.warn("event=query_rejected reason=content_safety matched={} risk={}", safety.matched(), safety.riskLevel());
            throw new UnsafeContentException(safety.matched());
        }

        List<ScoredChunk> results = retriever.retrieve(question, topK, mode);
        AnswerResponse answer = generateAnswer ? answerGenerator.generate(question, results) : null;

        log.info("event=rag_query_done mode={} topK={} results={} answer={} ms={}",
                mode.wireName(), topK, results.size(), answer == null ? "none" : answer.getStatus(),
                (System.nanoTime() - t0) / 1_000_000);

        return QueryResponse.builder()
                .question(question)
                .searchMode(mode.wireName())
                .results(results)
                .totalResults(results.size())
                .answer(answer)
                .build();
    }

    public IngestResult ingest(List<DocumentPayload> documents) {
        if (documents.stream().anyMatch(Objects::isNull)) {
            throw BusinessException.badRequest("documents must not contain null entries");
        }
        List<ParsedDocument> parsed = documents.stream()
                .map(DocumentPayload::toParsedDocument)
                .toList();
        return ingestService.ingest(parsed);
    }

    /**
     * Extracts and ingests an uploaded PDF. Without an explicit id the document id is the MD5 of the file
     * bytes, so uploading the same file again overwrites its chunks.
     */
    public IngestResult ingestPdf(MultipartFile file, String documentId, String sourceUrl) {
        if (file == null || file.isEmpty()) {
            throw BusinessException.badRequest("file is required");
        }
        String filename = file.getOriginalFilename() == null ? "upload.pdf" : file.getOriginalFilename();
        if (!filename.toLowerCase().endsWith(".pdf")) {
            throw BusinessException.badRequest("Only PDF uploads are supported");
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new BusinessException(HttpStatus.BAD_REQUEST, "Failed to read PDF upload", e);
        }

        String id = StringUtils.hasText(documentId) ? documentId.trim() : DigestUtils.md5DigestAsHex(bytes);
        ParsedDocument parsed = pdfExtractor.parse(id, filename, sourceUrl, new ByteArrayInputStream(bytes));
        return ingestService.ingest(List.of(parsed));
    }

    public CacheStats cacheStats() {
        return retriever.stats();
    }

    public void clearCache() {
        retriever.clear();
    }

    public Map<String, Object> health() {
        String cluster;
        try {
            cluster = store.health();
        } catch (ChunkStoreException e) {
            log.warn("event=health_failed err={}", e.toString());
            throw new BusinessException(HttpStatus.SERVICE_UNAVAILABLE, "Elasticsearch is unreachable", e);
        }

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "red".equals(cluster) ? "unhealthy" : "healthy");
        health.put("elasticsearch", cluster);
        health.put("dense_embeddings", denseGenerator.available());
        health.put("sparse_expansion", sparseGenerator.enabled());
        return health;
    }
}
