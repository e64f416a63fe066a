package com.batchembedding;

import com.batchembedding.EmbeddingFailureException.FailureKind;
import com.batchembedding.transport.EmbeddingTransport;
import com.batchembedding.transport.RawResponse;
import com.batchembedding.transport.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Sends batches through an {@link EmbeddingTransport} and classifies the answers.
 *
 * <p>Two modes are offered. {@link #embedBatch(List)} sends once and fails fast on anything but
 * success. {@link #embedBatchResilient(List, int, boolean)} never fails on remote errors: transient
 * server errors are retried on the unchanged batch while gas remains, token-limit rejections split the
 * batch in half (without spending gas) down to single inputs, and every other failure drops the
 * branch. The result is the concatenation of whatever the branches produced, first half first.</p>
 *
 * <p>If a {@link ForkJoinPool} is supplied, the two halves of a split are evaluated in parallel.
 * Branches share no mutable state; gas and the retry attempt travel by value.</p>
 */
public class BatchRetryEngine {

    private static final Logger logger = LogManager.getLogger(BatchRetryEngine.class);
    private static final Logger traceLogger = LogManager.getLogger(ClientConstants.TRACE_LOGGER_NAME);
    private static final int MAX_BODY_SNIPPET = 256;

    private final EmbeddingTransport transport;
    private final ResponseClassifier classifier;
    private final SessionContext session;
    private final BackoffStrategy backoffStrategy;
    private final ForkJoinPool splitPool;

    public BatchRetryEngine(EmbeddingTransport transport, SessionContext session) {
        this(transport, new ResponseClassifier(), session, BackoffStrategy.none(), null);
    }

    /**
     * @param splitPool pool for evaluating split halves in parallel, or null to evaluate them sequentially
     */
    public BatchRetryEngine(EmbeddingTransport transport, ResponseClassifier classifier, SessionContext session,
                            BackoffStrategy backoffStrategy, ForkJoinPool splitPool) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.session = Objects.requireNonNull(session, "session");
        this.backoffStrategy = Objects.requireNonNull(backoffStrategy, "backoffStrategy");
        this.splitPool = splitPool;
    }

    /**
     * Sends the batch once, without retry or splitting.
     *
     * @return the embeddings in response order, indexed relative to {@code batch}
     * @throws EmbeddingFailureException tagged with the failure kind on an API error or malformed response
     * @throws TransportException if the HTTP exchange fails
     */
    public List<IndexedEmbedding> embedBatch(List<String> batch) throws EmbeddingFailureException {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            return List.of();
        }

        RawResponse response = transport.send(List.copyOf(batch), session);
        ParseOutcome outcome = classifier.parse(response.getBody());
        switch (outcome.getKind()) {
            case EMBEDDINGS:
                logger.debug("Embedded batch of {} inputs, received {} embeddings", batch.size(), outcome.getEmbeddings().size());
                return outcome.getEmbeddings();
            case API_ERROR:
                ApiError apiError = outcome.getApiError();
                throw new EmbeddingFailureException(FailureKind.of(apiError.kind()),
                    apiError.getMessage() + " (type: " + apiError.getType() + ", HTTP " + response.getStatusCode() + ")");
            default:
                throw new EmbeddingFailureException(FailureKind.MALFORMED_RESPONSE,
                    outcome.getReason() + ", body: " + snippet(outcome.getRawBody()), outcome.getCause());
        }
    }

    /**
     * Embeds the batch best-effort. Never throws for remote failures; inputs that cannot be embedded
     * are silently dropped.
     *
     * @param gas number of unchanged-batch retries allowed after server errors; zero or less sends nothing
     * @param trace when true, log a notice for each decision on the trace logger
     * @return embeddings as returned by each successful request, indices relative to the sub-batch that
     *         produced them, concatenated in input order of the sub-batches
     */
    public List<IndexedEmbedding> embedBatchResilient(List<String> batch, int gas, boolean trace) {
        Objects.requireNonNull(batch, "batch");
        return run(new Branch(List.copyOf(batch), 0, gas, 0), trace, false);
    }

    /**
     * Same algorithm as {@link #embedBatchResilient(List, int, boolean)}, but indices are rewritten to
     * positions in {@code batch} and the result is sorted by index. Entries whose index does not fall
     * inside the sub-batch that produced them are discarded.
     */
    public List<IndexedEmbedding> embedBatchResilientAligned(List<String> batch, int gas, boolean trace) {
        Objects.requireNonNull(batch, "batch");
        List<IndexedEmbedding> result = new ArrayList<>(run(new Branch(List.copyOf(batch), 0, gas, 0), trace, true));
        result.sort(Comparator.comparingInt(IndexedEmbedding::getIndex));
        return result;
    }

    private List<IndexedEmbedding> run(Branch root, boolean trace, boolean align) {
        if (splitPool == null || ForkJoinTask.getPool() == splitPool) {
            return resilient(root, trace, align);
        }
        return splitPool.invoke(new ResilientTask(root, trace, align));
    }

    /**
     * Retries of the unchanged batch run in this loop; only splits recurse, so the stack depth is bounded
     * by log2 of the batch size rather than by gas.
     */
    private List<IndexedEmbedding> resilient(Branch branch, boolean trace, boolean align) {
        Branch current = branch;
        while (true) {
            List<String> batch = current.batch;
            if (current.gas <= 0) {
                trace(trace, "Out of gas, dropping batch of {} inputs", batch.size());
                logger.debug("Gas exhausted for batch of {} inputs at offset {}", batch.size(), current.offset);
                return List.of();
            }
            if (batch.isEmpty()) {
                trace(trace, "Empty batch, nothing to embed");
                return List.of();
            }

            ParseOutcome outcome;
            try {
                RawResponse response = send(batch);
                outcome = classifier.parse(response.getBody());
            } catch (TransportException e) {
                trace(trace, "Transport failure for batch of {} inputs, dropping it: {}", batch.size(), e.getMessage());
                logger.debug("Dropping batch of {} inputs at offset {} after transport failure", batch.size(), current.offset, e);
                return List.of();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while sending batch of {} inputs, dropping it", batch.size());
                return List.of();
            }

            if (outcome.getKind() == ParseOutcome.Kind.EMBEDDINGS) {
                List<IndexedEmbedding> embeddings = outcome.getEmbeddings();
                trace(trace, "Embedded batch of {} inputs, received {} embeddings", batch.size(), embeddings.size());
                return align ? rebase(embeddings, current) : embeddings;
            }
            if (outcome.getKind() == ParseOutcome.Kind.MALFORMED) {
                trace(trace, "Could not parse response for batch of {} inputs, dropping it: {}", batch.size(), outcome.getReason());
                logger.debug("Malformed response ({}) for batch at offset {}: {}",
                    outcome.getMalformation(), current.offset, snippet(outcome.getRawBody()));
                return List.of();
            }

            ApiError apiError = outcome.getApiError();
            if (apiError.kind() != ApiErrorKind.SERVER_ERROR) {
                return onApiError(current, apiError, trace, align);
            }
            trace(trace, "Server error on batch of {} inputs ({}), retrying with {} gas left",
                batch.size(), apiError.getMessage(), current.gas - 1);
            if (!awaitBackoff(current.attempt)) {
                return List.of();
            }
            current = current.retry();
        }
    }

    private List<IndexedEmbedding> onApiError(Branch branch, ApiError apiError, boolean trace, boolean align) {
        int size = branch.batch.size();
        if (apiError.kind() == ApiErrorKind.TOKEN_LIMIT) {
            if (size == 1) {
                trace(trace, "Token limit exceeded by a single input, giving up on it: {}", apiError.getMessage());
                logger.debug("Dropping input at offset {}: exceeds token limit", branch.offset);
                return List.of();
            }
            int mid = size / 2;
            trace(trace, "Token limit exceeded by batch of {} inputs, splitting into batches of {} and {}",
                size, mid, size - mid);
            return embedHalves(branch.slice(0, mid), branch.slice(mid, size), trace, align);
        }
        trace(trace, "Unrecognized API error on batch of {} inputs, giving up: {} (type: {})",
            size, apiError.getMessage(), apiError.getType());
        logger.debug("Dropping batch of {} inputs at offset {} after API error {}", size, branch.offset, apiError);
        return List.of();
    }

    private List<IndexedEmbedding> embedHalves(Branch first, Branch second, boolean trace, boolean align) {
        List<IndexedEmbedding> firstResult;
        List<IndexedEmbedding> secondResult;
        if (splitPool != null && ForkJoinTask.getPool() == splitPool) {
            ResilientTask firstTask = new ResilientTask(first, trace, align);
            firstTask.fork();
            secondResult = resilient(second, trace, align);
            firstResult = firstTask.join();
        } else {
            firstResult = resilient(first, trace, align);
            secondResult = resilient(second, trace, align);
        }

        List<IndexedEmbedding> combined = new ArrayList<>(firstResult.size() + secondResult.size());
        combined.addAll(firstResult);
        combined.addAll(secondResult);
        return combined;
    }

    /** Inside a fork/join worker the blocking call is announced to the pool so it can add a spare thread. */
    private RawResponse send(List<String> batch) throws TransportException, InterruptedException {
        if (!ForkJoinTask.inForkJoinPool()) {
            return transport.send(batch, session);
        }
        SendBlocker blocker = new SendBlocker(batch);
        ForkJoinPool.managedBlock(blocker);
        if (blocker.failure != null) {
            throw blocker.failure;
        }
        return blocker.response;
    }

    private boolean awaitBackoff(int attempt) {
        long delay = backoffStrategy.delayFor(attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            if (ForkJoinTask.inForkJoinPool()) {
                ForkJoinPool.managedBlock(new SleepBlocker(delay));
            } else {
                Thread.sleep(delay);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting {}ms before retry, dropping batch", delay);
            return false;
        }
    }

    private static List<IndexedEmbedding> rebase(List<IndexedEmbedding> embeddings, Branch branch) {
        List<IndexedEmbedding> rebased = new ArrayList<>(embeddings.size());
        for (IndexedEmbedding embedding : embeddings) {
            if (embedding.getIndex() >= branch.batch.size()) {
                logger.debug("Ignoring embedding index={} outside batch of {} inputs", embedding.getIndex(), branch.batch.size());
                continue;
            }
            rebased.add(embedding.withIndex(branch.offset + embedding.getIndex()));
        }
        return rebased;
    }

    private static void trace(boolean enabled, String message, Object... params) {
        if (enabled) {
            traceLogger.info(message, params);
        }
    }

    private static String snippet(String body) {
        if (body == null) {
            return "<null>";
        }
        String flat = body.replace("\r", " ").replace("\n", " ");
        return flat.length() > MAX_BODY_SNIPPET ? flat.substring(0, MAX_BODY_SNIPPET) + "..." : flat;
    }

    /** One unit of recursive work: a contiguous slice of the caller's batch plus its budget. */
    private static final class Branch {
        private final List<String> batch;
        private final int offset;
        private final int gas;
        private final int attempt;

        private Branch(List<String> batch, int offset, int gas, int attempt) {
            this.batch = batch;
            this.offset = offset;
            this.gas = gas;
            this.attempt = attempt;
        }

        private Branch retry() {
            return new Branch(batch, offset, gas - 1, attempt + 1);
        }

        private Branch slice(int from, int to) {
            return new Branch(batch.subList(from, to), offset + from, gas, 0);
        }
    }

    private final class SendBlocker implements ForkJoinPool.ManagedBlocker {
        private final List<String> batch;
        private RawResponse response;
        private TransportException failure;
        private boolean done;

        private SendBlocker(List<String> batch) {
            this.batch = batch;
        }

        @Override
        public boolean block() {
            if (!done) {
                try {
                    response = transport.send(batch, session);
                } catch (TransportException e) {
                    failure = e;
                }
                done = true;
            }
            return true;
        }

        @Override
        public boolean isReleasable() {
            return done;
        }
    }

    private static final class SleepBlocker implements ForkJoinPool.ManagedBlocker {
        private final long delayMillis;
        private boolean done;

        private SleepBlocker(long delayMillis) {
            this.delayMillis = delayMillis;
        }

        @Override
        public boolean block() throws InterruptedException {
            if (!done) {
                Thread.sleep(delayMillis);
                done = true;
            }
            return true;
        }

        @Override
        public boolean isReleasable() {
            return done;
        }
    }

    private final class ResilientTask extends RecursiveTask<List<IndexedEmbedding>> {
        private final Branch branch;
        private final boolean trace;
        private final boolean align;

        private ResilientTask(Branch branch, boolean trace, boolean align) {
            this.branch = branch;
            this.trace = trace;
            this.align = align;
        }

        @Override
        protected List<IndexedEmbedding> compute() {
            return resilient(branch, trace, align);
        }
    }
}
