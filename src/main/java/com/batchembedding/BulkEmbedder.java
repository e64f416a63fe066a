package com.batchembedding;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Embeds an arbitrarily long input list by cutting it into consecutive batches and feeding each
 * to a {@link BatchRetryEngine}. Returned indices are positions in the full input list.
 */
public class BulkEmbedder {

    private static final Logger logger = LogManager.getLogger(BulkEmbedder.class);

    private final BatchRetryEngine engine;
    private final int maxBatchSize;
    private final int gas;
    private final boolean trace;

    public BulkEmbedder(BatchRetryEngine engine, int maxBatchSize, int gas, boolean trace) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException(ClientConstants.ERROR_INVALID_CONFIG + ClientConstants.CONFIG_MAX_BATCH_SIZE
                + "]: must be positive");
        }
        this.engine = Objects.requireNonNull(engine, "engine");
        this.maxBatchSize = maxBatchSize;
        this.gas = gas;
        this.trace = trace;
    }

    /**
     * Best-effort embedding of every input; dropped inputs are simply absent from the result.
     *
     * @return embeddings ordered by their position in {@code inputs}
     */
    public List<IndexedEmbedding> embedAll(List<String> inputs) {
        requireNoNulls(inputs);
        logger.info("Embedding {} inputs in batches of at most {}", inputs.size(), maxBatchSize);

        List<IndexedEmbedding> results = new ArrayList<>(inputs.size());
        for (int start = 0; start < inputs.size(); start += maxBatchSize) {
            int end = Math.min(start + maxBatchSize, inputs.size());
            for (IndexedEmbedding embedding : engine.embedBatchResilientAligned(inputs.subList(start, end), gas, trace)) {
                results.add(embedding.withIndex(start + embedding.getIndex()));
            }
        }

        if (results.size() < inputs.size()) {
            logger.warn("Embedded {} of {} inputs; {} were dropped", results.size(), inputs.size(), inputs.size() - results.size());
        } else {
            logger.info("Embedded all {} inputs", inputs.size());
        }
        return results;
    }

    /**
     * Fail-fast embedding of every input, one request per batch and no retries.
     *
     * @throws EmbeddingFailureException on the first batch that does not succeed, naming its range
     */
    public List<IndexedEmbedding> embedAllStrict(List<String> inputs) throws EmbeddingFailureException {
        requireNoNulls(inputs);

        List<IndexedEmbedding> results = new ArrayList<>(inputs.size());
        for (int start = 0; start < inputs.size(); start += maxBatchSize) {
            int end = Math.min(start + maxBatchSize, inputs.size());
            List<IndexedEmbedding> batchEmbeddings;
            try {
                batchEmbeddings = engine.embedBatch(inputs.subList(start, end));
            } catch (EmbeddingFailureException e) {
                logger.error("Embedding failed for batch [{}..{}]: {}", start, end - 1, e.getMessage());
                throw e;
            }
            int size = end - start;
            for (IndexedEmbedding embedding : batchEmbeddings) {
                if (embedding.getIndex() >= size) {
                    logger.debug("Ignoring embedding index={} outside batch [{}..{}]", embedding.getIndex(), start, end - 1);
                    continue;
                }
                results.add(embedding.withIndex(start + embedding.getIndex()));
            }
        }
        return results;
    }

    private static void requireNoNulls(List<String> inputs) {
        Objects.requireNonNull(inputs, "inputs");
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i) == null) {
                throw new IllegalArgumentException("input at position " + i + " is null");
            }
        }
    }
}
