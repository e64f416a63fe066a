package com.batchembedding;

import com.batchembedding.transport.OpenAITransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;

/**
 * Builds engines and bulk embedders from a configuration map keyed by the {@code CONFIG_*}
 * constants of {@link ClientConstants}. Missing keys take their defaults.
 */
public class BatchEmbedderFactory {

    private static final Logger logger = LogManager.getLogger(BatchEmbedderFactory.class);

    private final Function<String, String> environment;

    public BatchEmbedderFactory() {
        this(System::getenv);
    }

    BatchEmbedderFactory(Function<String, String> environment) {
        this.environment = environment;
    }

    public BatchRetryEngine createEngine(Map<String, Object> config) {
        Map<String, Object> processedConfig = withDefaults(config);

        SessionContext session = createSession(processedConfig);
        OpenAITransport transport = new OpenAITransport(processedConfig);
        BackoffStrategy backoffStrategy = new BackoffStrategy(
            ConfigValues.getLong(processedConfig, ClientConstants.CONFIG_BACKOFF_INITIAL_DELAY_MS, ClientConstants.DEFAULT_BACKOFF_INITIAL_DELAY_MS),
            ConfigValues.getLong(processedConfig, ClientConstants.CONFIG_BACKOFF_MAX_DELAY_MS, ClientConstants.DEFAULT_BACKOFF_MAX_DELAY_MS),
            ConfigValues.getDouble(processedConfig, ClientConstants.CONFIG_BACKOFF_MULTIPLIER, ClientConstants.DEFAULT_BACKOFF_MULTIPLIER));
        boolean parallelSplits = ConfigValues.getBoolean(processedConfig, ClientConstants.CONFIG_PARALLEL_SPLITS, false);

        logger.info("Created embedding engine for model {} at {} (parallel splits: {})",
            transport.getModel(), processedConfig.get(ClientConstants.CONFIG_API_URL), parallelSplits);
        return new BatchRetryEngine(transport, new ResponseClassifier(), session, backoffStrategy,
            parallelSplits ? ForkJoinPool.commonPool() : null);
    }

    public BulkEmbedder createBulkEmbedder(Map<String, Object> config) {
        Map<String, Object> processedConfig = withDefaults(config);
        return new BulkEmbedder(createEngine(processedConfig),
            ConfigValues.getInt(processedConfig, ClientConstants.CONFIG_MAX_BATCH_SIZE, ClientConstants.DEFAULT_MAX_BATCH_SIZE),
            ConfigValues.getInt(processedConfig, ClientConstants.CONFIG_GAS, ClientConstants.DEFAULT_GAS),
            ConfigValues.getBoolean(processedConfig, ClientConstants.CONFIG_TRACE, false));
    }

    SessionContext createSession(Map<String, Object> config) {
        String apiKey = ConfigValues.getString(config, ClientConstants.CONFIG_API_KEY, null);
        if (apiKey != null) {
            return SessionContext.of(apiKey);
        }
        String variableName = ConfigValues.getString(config, ClientConstants.CONFIG_API_KEY_ENV, ClientConstants.DEFAULT_API_KEY_ENV);
        return SessionContext.fromEnvironment(variableName, environment);
    }

    static Map<String, Object> withDefaults(Map<String, Object> config) {
        Map<String, Object> processedConfig = new HashMap<>(config);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_API_URL, ClientConstants.DEFAULT_API_URL);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_MODEL, ClientConstants.DEFAULT_MODEL);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_API_KEY_ENV, ClientConstants.DEFAULT_API_KEY_ENV);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_CONNECT_TIMEOUT, ClientConstants.DEFAULT_CONNECT_TIMEOUT);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_READ_TIMEOUT, ClientConstants.DEFAULT_READ_TIMEOUT);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_GAS, ClientConstants.DEFAULT_GAS);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_MAX_BATCH_SIZE, ClientConstants.DEFAULT_MAX_BATCH_SIZE);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_BACKOFF_INITIAL_DELAY_MS, ClientConstants.DEFAULT_BACKOFF_INITIAL_DELAY_MS);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_BACKOFF_MAX_DELAY_MS, ClientConstants.DEFAULT_BACKOFF_MAX_DELAY_MS);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_BACKOFF_MULTIPLIER, ClientConstants.DEFAULT_BACKOFF_MULTIPLIER);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_PARALLEL_SPLITS, false);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_TRACE, false);
        processedConfig.putIfAbsent(ClientConstants.CONFIG_HEADERS, new HashMap<String, String>());
        return processedConfig;
    }
}
