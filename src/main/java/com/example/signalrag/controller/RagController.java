package com.example.signalrag.controller;

import com.example.signalrag.application.service.CacheStats;
import com.example.signalrag.application.service.RagApplicationService;
import com.example.signalrag.controller.exception.InvalidSearchModeException;
import com.example.signalrag.domain.dto.IngestRequest;
import com.example.signalrag.domain.dto.QueryRequest;
import com.example.signalrag.domain.dto.QueryResponse;
import com.example.signalrag.domain.dto.ResponseData;
import com.example.signalrag.domain.model.SearchMode;
import com.example.signalrag.infrastructure.ingest.IngestResult;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/rag")
public class RagController {

    private final RagApplicationService ragApplicationService;

    public RagController(RagApplicationService ragApplicationService) {
        this.ragApplicationService = ragApplicationService;
    }

    @PostMapping(
            path = "/query",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<QueryResponse>> query(@Valid @RequestBody QueryRequest request) {
        SearchMode mode = resolveMode(request.getSearchMode());
        QueryResponse response = ragApplicationService.query(
                request.getQuestion(), request.getTopK(), mode, request.isGenerateAnswer());
        return ResponseEntity.ok(ResponseData.ok("Query executed successfully", response));
    }

    @PostMapping(
            path = "/ingest",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<IngestResult>> ingest(@Valid @RequestBody IngestRequest request) {
        IngestResult result = ragApplicationService.ingest(request.getDocuments());
        return ResponseEntity.ok(ResponseData.ok("Documents ingested", result));
    }

    @PostMapping(
            path = "/ingest/pdf",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<IngestResult>> ingestPdf(
            @RequestPart("file") MultipartFile file,
            @RequestParam(name = "documentId", required = false) String documentId,
            @RequestParam(name = "sourceUrl", required = false) String sourceUrl
    ) {
        IngestResult result = ragApplicationService.ingestPdf(file, documentId, sourceUrl);
        return ResponseEntity.ok(ResponseData.ok("PDF ingested", result));
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<Map<String, Object>>> health() {
        return ResponseEntity.ok(ResponseData.ok("OK", ragApplicationService.health()));
    }

    @GetMapping(path = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<CacheStats>> cacheStats() {
        return ResponseEntity.ok(ResponseData.ok("OK", ragApplicationService.cacheStats()));
    }

    @DeleteMapping(path = "/cache", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<Void>> clearCache() {
        ragApplicationService.clearCache();
        return ResponseEntity.ok(ResponseData.ok("Cache cleared", null));
    }

    // parsed before any retrieval so that a bad mode never reaches the store
    private static SearchMode resolveMode(String value) {
        if (value == null) {
            return SearchMode.DENSE_LEXICAL;
        }
        return SearchMode.fromWireName(value).orElseThrow(() -> new InvalidSearchModeException(value));
    }
}
