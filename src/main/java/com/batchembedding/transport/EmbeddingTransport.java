package com.batchembedding.transport;

import com.batchembedding.SessionContext;

import java.util.List;

public interface EmbeddingTransport {
    /**
     * Sends one batch of input strings to the embedding endpoint.
     * @param batch The ordered inputs to embed.
     * @param session The credential used to authenticate the request.
     * @return The raw response; the body is not interpreted.
     * @throws TransportException If the exchange fails before a response is read.
     */
    RawResponse send(List<String> batch, SessionContext session) throws TransportException;
}
