package com.example.signalrag.infrastructure.search;

public class ChunkStoreException extends RuntimeException {

    public ChunkStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
