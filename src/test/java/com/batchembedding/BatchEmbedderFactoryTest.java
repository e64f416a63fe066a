package com.batchembedding;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class BatchEmbedderFactoryTest {

    @Test
    public void testDefaultsAreFilledIn() {
        Map<String, Object> processed = BatchEmbedderFactory.withDefaults(new HashMap<>());

        assertEquals(ClientConstants.DEFAULT_API_URL, processed.get(ClientConstants.CONFIG_API_URL));
        assertEquals(ClientConstants.DEFAULT_MODEL, processed.get(ClientConstants.CONFIG_MODEL));
        assertEquals(ClientConstants.DEFAULT_GAS, processed.get(ClientConstants.CONFIG_GAS));
        assertEquals(Boolean.FALSE, processed.get(ClientConstants.CONFIG_TRACE));
    }

    @Test
    public void testExplicitKeyWinsOverEnvironment() {
        Map<String, String> environment = Map.of(ClientConstants.DEFAULT_API_KEY_ENV, "sk-env");
        BatchEmbedderFactory factory = new BatchEmbedderFactory(environment::get);
        Map<String, Object> config = new HashMap<>();
        config.put(ClientConstants.CONFIG_API_KEY, "sk-explicit");

        assertEquals("sk-explicit", factory.createSession(BatchEmbedderFactory.withDefaults(config)).getApiKey());
        assertEquals("sk-env", factory.createSession(BatchEmbedderFactory.withDefaults(new HashMap<>())).getApiKey());
    }

    @Test
    public void testCustomEnvironmentVariable() {
        Map<String, String> environment = Map.of("EMBEDDINGS_KEY", "sk-custom");
        BatchEmbedderFactory factory = new BatchEmbedderFactory(environment::get);
        Map<String, Object> config = new HashMap<>();
        config.put(ClientConstants.CONFIG_API_KEY_ENV, "EMBEDDINGS_KEY");

        assertEquals("sk-custom", factory.createSession(BatchEmbedderFactory.withDefaults(config)).getApiKey());
    }

    @Test
    public void testMissingCredentialFailsFast() {
        BatchEmbedderFactory factory = new BatchEmbedderFactory(name -> null);

        assertThrows(IllegalStateException.class, () -> factory.createEngine(new HashMap<>()));
    }

    @Test
    public void testCreatesBulkEmbedder() {
        Map<String, Object> config = new HashMap<>();
        config.put(ClientConstants.CONFIG_API_KEY, "sk-explicit");
        config.put(ClientConstants.CONFIG_MAX_BATCH_SIZE, "64");
        config.put(ClientConstants.CONFIG_PARALLEL_SPLITS, true);
        config.put(ClientConstants.CONFIG_BACKOFF_MULTIPLIER, 1.5);

        assertNotNull(new BatchEmbedderFactory(name -> null).createBulkEmbedder(config));
    }

    @Test
    public void testWrongValueTypeNamesTheKey() {
        Map<String, Object> config = new HashMap<>();
        config.put(ClientConstants.CONFIG_API_KEY, "sk-explicit");
        config.put(ClientConstants.CONFIG_GAS, 2.5);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new BatchEmbedderFactory(name -> null).createBulkEmbedder(config));
        assertTrue(e.getMessage().contains(ClientConstants.CONFIG_GAS));
    }
}
