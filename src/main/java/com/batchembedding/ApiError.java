package com.batchembedding;

import java.util.Objects;

/**
 * Structured error object reported by the embedding API.
 */
public final class ApiError {

    private final String message;
    private final String type;

    public ApiError(String message, String type) {
        this.message = message;
        this.type = type;
    }

    public String getMessage() {
        return message;
    }

    public String getType() {
        return type;
    }

    public ApiErrorKind kind() {
        return ApiErrorKind.fromType(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ApiError)) {
            return false;
        }
        ApiError apiError = (ApiError) o;
        return Objects.equals(message, apiError.message) && Objects.equals(type, apiError.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, type);
    }

    @Override
    public String toString() {
        return "ApiError{type='" + type + "', message='" + message + "'}";
    }
}
