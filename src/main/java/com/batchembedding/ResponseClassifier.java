package com.batchembedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw response body into a {@link ParseOutcome}.
 *
 * <p>The {@code error} shape is checked before the {@code data} shape, so a body carrying both
 * is reported as an API error.</p>
 */
public class ResponseClassifier {

    private static final Logger logger = LogManager.getLogger(ResponseClassifier.class);
    // A valid document followed by anything else (an HTML error page, a second object) is not valid JSON.
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public ParseOutcome parse(String rawBody) {
        if (rawBody == null) {
            return ParseOutcome.invalidJson(null, null);
        }

        JsonNode rootNode;
        try {
            rootNode = MAPPER.readTree(rawBody);
        } catch (JsonProcessingException e) {
            logger.debug("Response body is not valid JSON: {}", e.getOriginalMessage());
            return ParseOutcome.invalidJson(rawBody, e);
        }
        // readTree yields a MissingNode for blank input
        if (rootNode == null || rootNode.isMissingNode()) {
            return ParseOutcome.invalidJson(rawBody, null);
        }

        ApiError apiError = readError(rootNode);
        if (apiError != null) {
            logger.debug("Response carries API error of type '{}'", apiError.getType());
            return ParseOutcome.apiError(apiError);
        }

        List<IndexedEmbedding> embeddings = readData(rootNode);
        if (embeddings != null) {
            logger.debug("Response carries {} embeddings", embeddings.size());
            return ParseOutcome.embeddings(embeddings);
        }

        return ParseOutcome.schemaMismatch(rawBody);
    }

    private ApiError readError(JsonNode rootNode) {
        JsonNode errorNode = rootNode.get(ClientConstants.FIELD_ERROR);
        if (errorNode == null || !errorNode.isObject()) {
            return null;
        }
        JsonNode messageNode = errorNode.get(ClientConstants.FIELD_MESSAGE);
        JsonNode typeNode = errorNode.get(ClientConstants.FIELD_TYPE);
        if (messageNode == null || !messageNode.isTextual() || typeNode == null || !typeNode.isTextual()) {
            return null;
        }
        return new ApiError(messageNode.textValue(), typeNode.textValue());
    }

    private List<IndexedEmbedding> readData(JsonNode rootNode) {
        JsonNode dataNode = rootNode.get(ClientConstants.FIELD_DATA);
        if (dataNode == null || !dataNode.isArray()) {
            return null;
        }

        List<IndexedEmbedding> embeddings = new ArrayList<>(dataNode.size());
        for (JsonNode itemNode : dataNode) {
            if (!itemNode.isObject()) {
                return null;
            }
            JsonNode indexNode = itemNode.get(ClientConstants.FIELD_INDEX);
            JsonNode embeddingNode = itemNode.get(ClientConstants.FIELD_EMBEDDING);
            if (indexNode == null || !indexNode.canConvertToInt() || !indexNode.isIntegralNumber()
                || indexNode.intValue() < 0) {
                return null;
            }
            if (embeddingNode == null || !embeddingNode.isArray()) {
                return null;
            }

            List<Float> vector = new ArrayList<>(embeddingNode.size());
            for (JsonNode valueNode : embeddingNode) {
                if (!valueNode.isNumber()) {
                    return null;
                }
                vector.add(valueNode.floatValue());
            }
            embeddings.add(new IndexedEmbedding(indexNode.intValue(), vector));
        }
        return embeddings;
    }
}
