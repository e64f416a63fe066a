package com.batchembedding.transport;

import com.batchembedding.ClientConstants;
import com.batchembedding.ConfigValues;
import com.batchembedding.HttpHelper;
import com.batchembedding.SessionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Sends batches to an OpenAI-compatible {@code /v1/embeddings} endpoint.
 */
public class OpenAITransport implements EmbeddingTransport {

    private static final Logger logger = LogManager.getLogger(OpenAITransport.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpHelper httpHelper;
    private final String model;

    public OpenAITransport(Map<String, Object> config) {
        this(new HttpHelper(config), ConfigValues.getString(config, ClientConstants.CONFIG_MODEL, ClientConstants.DEFAULT_MODEL));
    }

    public OpenAITransport(HttpHelper httpHelper, String model) {
        if (model == null || model.trim().isEmpty()) {
            throw new IllegalArgumentException(ClientConstants.ERROR_INVALID_CONFIG + ClientConstants.CONFIG_MODEL + "]: model must not be blank");
        }
        this.httpHelper = httpHelper;
        this.model = model;
    }

    @Override
    public RawResponse send(List<String> batch, SessionContext session) throws TransportException {
        String requestBody = buildRequestBody(batch);
        logger.debug("Sending batch of {} inputs to {} with model {}", batch.size(), httpHelper.getApiUrl(), model);
        RawResponse response = httpHelper.post(requestBody, session.authorizationHeader());
        if (!response.isSuccessful()) {
            logger.debug("Embedding endpoint answered HTTP {}", response.getStatusCode());
        }
        return response;
    }

    String buildRequestBody(List<String> batch) throws TransportException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(ClientConstants.FIELD_MODEL, model);
        ArrayNode input = root.putArray(ClientConstants.FIELD_INPUT);
        for (String text : batch) {
            input.add(text);
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to serialize embedding request", e);
        }
    }

    public String getModel() {
        return model;
    }
}
