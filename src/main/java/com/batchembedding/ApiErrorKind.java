package com.batchembedding;

public enum ApiErrorKind {
    /** Transient, safe to retry the same batch. */
    SERVER_ERROR,
    /** Batch too large, must be shrunk before retrying. */
    TOKEN_LIMIT,
    UNKNOWN;

    public static ApiErrorKind fromType(String type) {
        if (ClientConstants.API_ERROR_TYPE_TOKEN_LIMIT.equals(type)) {
            return TOKEN_LIMIT;
        }
        if (ClientConstants.API_ERROR_TYPE_SERVER_ERROR.equals(type)) {
            return SERVER_ERROR;
        }
        return UNKNOWN;
    }
}
