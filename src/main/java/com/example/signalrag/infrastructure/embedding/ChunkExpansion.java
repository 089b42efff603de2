package com.example.signalrag.infrastructure.embedding;

import com.example.signalrag.domain.model.Chunk;
import com.example.signalrag.domain.model.SparseExpansion;
import java.util.Optional;

/**
 * A chunk paired with its sparse expansion, or with empty when the model produced none for it.
 */
public record ChunkExpansion(Chunk chunk, Optional<SparseExpansion> expansion) {
}
