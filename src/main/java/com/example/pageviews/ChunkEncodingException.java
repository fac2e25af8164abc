package com.example.pageviews;

/**
 * Dictionary state of an in-progress chunk can no longer be trusted. Fatal for the encoding
 * stream: the partial chunk is dropped and no further chunks are produced.
 */
public class ChunkEncodingException extends RuntimeException {

    public ChunkEncodingException(String message) {
        super(message);
    }

    public ChunkEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
