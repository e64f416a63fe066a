package com.batchembedding.transport;

import com.batchembedding.EmbeddingFailureException;

/**
 * The HTTP exchange itself failed; no response body was obtained.
 */
public class TransportException extends EmbeddingFailureException {

    public TransportException(String message) {
        super(FailureKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(FailureKind.TRANSPORT, message, cause);
    }
}
