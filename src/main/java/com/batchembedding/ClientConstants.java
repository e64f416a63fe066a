package com.batchembedding;

public final class ClientConstants {

    private ClientConstants() {
    }

    public static final String DEFAULT_API_URL = "https://api.openai.com/v1/embeddings";
    public static final String DEFAULT_MODEL = "text-embedding-3-small";
    public static final String DEFAULT_API_KEY_ENV = "OPENAI_API_KEY";
    public static final String DEFAULT_CONNECT_TIMEOUT = "5s";
    public static final String DEFAULT_READ_TIMEOUT = "30s";
    public static final int DEFAULT_GAS = 5;
    public static final int DEFAULT_MAX_BATCH_SIZE = 256;
    public static final long DEFAULT_BACKOFF_INITIAL_DELAY_MS = 1000L;
    public static final long DEFAULT_BACKOFF_MAX_DELAY_MS = 30000L;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public static final String CONFIG_API_URL = "api_url";
    public static final String CONFIG_API_KEY = "api_key";
    public static final String CONFIG_API_KEY_ENV = "api_key_env";
    public static final String CONFIG_MODEL = "model";
    public static final String CONFIG_HEADERS = "headers";
    public static final String CONFIG_CONNECT_TIMEOUT = "connect_timeout";
    public static final String CONFIG_READ_TIMEOUT = "read_timeout";
    public static final String CONFIG_GAS = "gas";
    public static final String CONFIG_MAX_BATCH_SIZE = "max_batch_size";
    public static final String CONFIG_BACKOFF_INITIAL_DELAY_MS = "backoff_initial_delay_ms";
    public static final String CONFIG_BACKOFF_MAX_DELAY_MS = "backoff_max_delay_ms";
    public static final String CONFIG_BACKOFF_MULTIPLIER = "backoff_multiplier";
    public static final String CONFIG_PARALLEL_SPLITS = "parallel_splits";
    public static final String CONFIG_TRACE = "trace";

    // Wire contract with the remote API, matched verbatim
    public static final String API_ERROR_TYPE_TOKEN_LIMIT = "invalid_request_error";
    public static final String API_ERROR_TYPE_SERVER_ERROR = "server error";

    public static final String FIELD_MODEL = "model";
    public static final String FIELD_INPUT = "input";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_DATA = "data";
    public static final String FIELD_INDEX = "index";
    public static final String FIELD_EMBEDDING = "embedding";

    public static final String TRACE_LOGGER_NAME = "com.batchembedding.trace";

    public static final String ERROR_SCHEMA_MISMATCH = "response matches neither error nor data schema";
    public static final String ERROR_INVALID_JSON = "response body is not valid JSON: ";
    public static final String ERROR_API_REQUEST_FAILED = "embedding request failed: ";
    public static final String ERROR_MISSING_API_KEY = "API key not found in environment variable ";
    public static final String ERROR_BLANK_API_KEY = "API key must not be blank";
    public static final String ERROR_INVALID_CONFIG = "invalid value for configuration key [";
}
