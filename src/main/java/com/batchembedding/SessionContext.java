package com.batchembedding;

import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable credential shared by every transport call of a run.
 */
public final class SessionContext {

    private final String apiKey;

    private SessionContext(String apiKey) {
        this.apiKey = apiKey;
    }

    /**
     * Creates a context from an explicitly supplied API key.
     * @param apiKey the API secret, must not be blank
     * @return the session context
     */
    public static SessionContext of(String apiKey) {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new IllegalArgumentException(ClientConstants.ERROR_BLANK_API_KEY);
        }
        return new SessionContext(apiKey.trim());
    }

    /**
     * Reads the API key from {@value ClientConstants#DEFAULT_API_KEY_ENV}.
     * @throws IllegalStateException if the variable is unset or blank
     */
    public static SessionContext fromEnvironment() {
        return fromEnvironment(ClientConstants.DEFAULT_API_KEY_ENV);
    }

    /**
     * Reads the API key from the named environment variable.
     * @throws IllegalStateException if the variable is unset or blank
     */
    public static SessionContext fromEnvironment(String variableName) {
        return fromEnvironment(variableName, System::getenv);
    }

    static SessionContext fromEnvironment(String variableName, Function<String, String> environment) {
        Objects.requireNonNull(variableName, "variableName");
        String value = environment.apply(variableName);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException(ClientConstants.ERROR_MISSING_API_KEY + variableName);
        }
        return new SessionContext(value.trim());
    }

    public String getApiKey() {
        return apiKey;
    }

    public String authorizationHeader() {
        return "Bearer " + apiKey;
    }

    @Override
    public String toString() {
        String visible = apiKey.substring(0, Math.min(4, apiKey.length()));
        return "SessionContext{apiKey=" + visible + "...}";
    }
}
