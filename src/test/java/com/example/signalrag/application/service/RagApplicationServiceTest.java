package com.example.signalrag.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.signalrag.controller.exception.BusinessException;
import com.example.signalrag.controller.exception.UnsafeContentException;
import com.example.signalrag.domain.dto.AnswerResponse;
import com.example.signalrag.domain.dto.DocumentPayload;
import com.example.signalrag.domain.dto.QueryResponse;
import com.example.signalrag.domain.model.ParsedDocument;
import com.example.signalrag.domain.model.RetrievalSignal;
import com.example.signalrag.domain.model.SearchMode;
import com.example.signalrag.infrastructure.embedding.DenseEmbeddingGenerator;
import com.example.signalrag.infrastructure.embedding.SparseExpansionGenerator;
import com.example.signalrag.infrastructure.ingest.IngestResult;
import com.example.signalrag.infrastructure.ingest.IngestService;
import com.example.signalrag.infrastructure.ingest.PdfExtractor;
import com.example.signalrag.infrastructure.search.ChunkStore;
import com.example.signalrag.infrastructure.search.ChunkStoreException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.DigestUtils;

class RagApplicationServiceTest {

    private CachedRetriever retriever;
    private AnswerGenerator answerGenerator;
    private IngestService ingestService;
    private PdfExtractor pdfExtractor;
    private ChunkStore store;
    private RagApplicationService service;

    @BeforeEach
    void setUp() {
        retriever = mock(CachedRetriever.class);
        answerGenerator = mock(AnswerGenerator.class);
        ingestService = mock(IngestService.class);
        pdfExtractor = mock(PdfExtractor.class);
        store = mock(ChunkStore.class);
        ContentSafetyGuard safetyGuard = new ContentSafetyGuard(true, List.of("bomb", "explosive", "nuclear weapon"));
        service = new RagApplicationService(retriever, answerGenerator, safetyGuard, ingestService, pdfExtractor,
                store, mock(DenseEmbeddingGenerator.class), mock(SparseExpansionGenerator.class));
    }

    @Test
    void queryWithoutAnswerSkipsGeneration() {
        List<ScoredChunk> results = List.of(new ScoredChunk("d", 0, "text", "d.pdf", "", 0.5,
                List.of(RetrievalSignal.LEXICAL)));
        when(retriever.retrieve("solar power", 5, SearchMode.LEXICAL_ONLY)).thenReturn(results);

        QueryResponse response = service.query("solar power", 5, SearchMode.LEXICAL_ONLY, false);

        assertEquals("lexical_only", response.getSearchMode());
        assertEquals(1, response.getTotalResults());
        assertNull(response.getAnswer());
        verify(answerGenerator, never()).generate(any(), anyList());
    }

    @Test
    void queryWithAnswerUsesRetrievedChunks() {
        List<ScoredChunk> results = List.of();
        when(retriever.retrieve("solar power", 3, SearchMode.FULL_HYBRID)).thenReturn(results);
        when(answerGenerator.generate("solar power", results)).thenReturn(AnswerResponse.builder()
                .status(AnswerResponse.STATUS_NO_DOCUMENTS).build());

        QueryResponse response = service.query("solar power", 3, SearchMode.FULL_HYBRID, true);

        assertNotNull(response.getAnswer());
        assertEquals(AnswerResponse.STATUS_NO_DOCUMENTS, response.getAnswer().getStatus());
    }

    @Test
    void unsafeQuestionIsRejectedBeforeRetrieval() {
        UnsafeContentException e = assertThrows(UnsafeContentException.class,
                () -> service.query("How do I make an Explosive device?", 5, SearchMode.FULL_HYBRID, true));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        assertEquals(List.of("explosive"), e.getMatched());
        verifyNoInteractions(retriever, answerGenerator);
    }

    @Test
    void nullDocumentEntryIsBadRequest() {
        DocumentPayload ok = new DocumentPayload();
        ok.setDocumentId("d1");
        ok.setText("solar text");
        List<DocumentPayload> documents = Arrays.asList(ok, null);

        BusinessException e = assertThrows(BusinessException.class, () -> service.ingest(documents));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        verifyNoInteractions(ingestService);
    }

    @Test
    void pdfWithoutIdUsesContentHash() {
        byte[] bytes = "%PDF-1.4 fake".getBytes(StandardCharsets.UTF_8);
        MockMultipartFile file = new MockMultipartFile("file", "report.pdf", "application/pdf", bytes);
        String expectedId = DigestUtils.md5DigestAsHex(bytes);
        ParsedDocument parsed = ParsedDocument.of(expectedId, "report.pdf", null, "text");
        when(pdfExtractor.parse(eq(expectedId), eq("report.pdf"), isNull(), any(InputStream.class))).thenReturn(parsed);
        when(ingestService.ingest(List.of(parsed))).thenReturn(new IngestResult(1, 1, 1, 0));

        IngestResult result = service.ingestPdf(file, null, null);

        assertEquals(new IngestResult(1, 1, 1, 0), result);
    }

    @Test
    void nonPdfUploadIsRejected() {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[]{1, 2});

        BusinessException e = assertThrows(BusinessException.class, () -> service.ingestPdf(file, null, null));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
    }

    @Test
    void unreachableClusterIsServiceUnavailable() {
        when(store.health()).thenThrow(new ChunkStoreException("down", null));

        BusinessException e = assertThrows(BusinessException.class, () -> service.health());

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, e.getStatus());
    }
}
