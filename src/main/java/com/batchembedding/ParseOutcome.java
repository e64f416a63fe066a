package com.batchembedding;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of classifying one response body. Exactly one of three shapes, selected by {@link #getKind()}:
 * a list of embeddings, an API error, or a malformed response.
 */
public final class ParseOutcome {

    public enum Kind {
        EMBEDDINGS,
        API_ERROR,
        MALFORMED
    }

    public enum Malformation {
        /** The body could not be parsed as JSON at all. */
        INVALID_JSON,
        /** Valid JSON, but neither the error nor the data shape. */
        SCHEMA_MISMATCH
    }

    private final Kind kind;
    private final List<IndexedEmbedding> embeddings;
    private final ApiError apiError;
    private final Malformation malformation;
    private final String reason;
    private final String rawBody;
    private final Throwable cause;

    private ParseOutcome(Kind kind, List<IndexedEmbedding> embeddings, ApiError apiError,
                         Malformation malformation, String reason, String rawBody, Throwable cause) {
        this.kind = kind;
        this.embeddings = embeddings;
        this.apiError = apiError;
        this.malformation = malformation;
        this.reason = reason;
        this.rawBody = rawBody;
        this.cause = cause;
    }

    public static ParseOutcome embeddings(List<IndexedEmbedding> embeddings) {
        return new ParseOutcome(Kind.EMBEDDINGS,
            Collections.unmodifiableList(Objects.requireNonNull(embeddings, "embeddings")),
            null, null, null, null, null);
    }

    public static ParseOutcome apiError(ApiError apiError) {
        return new ParseOutcome(Kind.API_ERROR, null, Objects.requireNonNull(apiError, "apiError"),
            null, null, null, null);
    }

    public static ParseOutcome invalidJson(String rawBody, Throwable cause) {
        String detail;
        if (cause != null) {
            detail = cause.getMessage();
        } else if (rawBody == null) {
            detail = "null body";
        } else {
            detail = "empty body";
        }
        return new ParseOutcome(Kind.MALFORMED, null, null, Malformation.INVALID_JSON,
            ClientConstants.ERROR_INVALID_JSON + detail, rawBody, cause);
    }

    public static ParseOutcome schemaMismatch(String rawBody) {
        return new ParseOutcome(Kind.MALFORMED, null, null, Malformation.SCHEMA_MISMATCH,
            ClientConstants.ERROR_SCHEMA_MISMATCH, rawBody, null);
    }

    public Kind getKind() {
        return kind;
    }

    public List<IndexedEmbedding> getEmbeddings() {
        requireKind(Kind.EMBEDDINGS);
        return embeddings;
    }

    public ApiError getApiError() {
        requireKind(Kind.API_ERROR);
        return apiError;
    }

    public Malformation getMalformation() {
        requireKind(Kind.MALFORMED);
        return malformation;
    }

    public String getReason() {
        requireKind(Kind.MALFORMED);
        return reason;
    }

    public String getRawBody() {
        requireKind(Kind.MALFORMED);
        return rawBody;
    }

    /** The JSON parse failure for {@link Malformation#INVALID_JSON}, otherwise null. */
    public Throwable getCause() {
        requireKind(Kind.MALFORMED);
        return cause;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("parse outcome is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case EMBEDDINGS:
                return "ParseOutcome{embeddings=" + embeddings.size() + "}";
            case API_ERROR:
                return "ParseOutcome{" + apiError + "}";
            default:
                return "ParseOutcome{" + malformation + ": " + reason + "}";
        }
    }
}
