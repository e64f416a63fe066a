package com.batchembedding;

import java.io.IOException;
import java.util.Locale;

/**
 * Terminal failure of a fail-fast embedding request. The message is prefixed with the
 * originating kind, e.g. {@code [server_error] ...}.
 */
public class EmbeddingFailureException extends IOException {

    public enum FailureKind {
        TRANSPORT,
        MALFORMED_RESPONSE,
        SERVER_ERROR,
        TOKEN_LIMIT,
        UNKNOWN_API_ERROR;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }

        static FailureKind of(ApiErrorKind apiErrorKind) {
            switch (apiErrorKind) {
                case SERVER_ERROR:
                    return SERVER_ERROR;
                case TOKEN_LIMIT:
                    return TOKEN_LIMIT;
                default:
                    return UNKNOWN_API_ERROR;
            }
        }
    }

    private final FailureKind kind;

    public EmbeddingFailureException(FailureKind kind, String message) {
        super(tagged(kind, message));
        this.kind = kind;
    }

    public EmbeddingFailureException(FailureKind kind, String message, Throwable cause) {
        super(tagged(kind, message), cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    private static String tagged(FailureKind kind, String message) {
        return "[" + kind.tag() + "] " + message;
    }
}
