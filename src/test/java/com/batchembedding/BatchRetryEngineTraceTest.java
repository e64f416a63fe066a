package com.batchembedding;

import com.batchembedding.transport.EmbeddingTransport;
import com.batchembedding.transport.RawResponse;
import com.batchembedding.transport.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

public class BatchRetryEngineTraceTest {

    private EmbeddingTransport transport;
    private BatchRetryEngine engine;
    private CapturingAppender appender;
    private Logger traceLogger;

    @Before
    public void setUp() throws Exception {
        transport = mock(EmbeddingTransport.class);
        engine = new BatchRetryEngine(transport, SessionContext.of("sk-test"));
        when(transport.send(anyList(), any(SessionContext.class))).thenAnswer(invocation -> {
            List<String> batch = invocation.getArgument(0);
            if (batch.size() > 1) {
                return BatchRetryEngineTest.error("invalid_request_error");
            }
            switch (batch.get(0)) {
                case "huge":
                    return BatchRetryEngineTest.error("invalid_request_error");
                case "flaky":
                    return BatchRetryEngineTest.error("server error");
                case "denied":
                    return BatchRetryEngineTest.error("authentication_error");
                case "garbled":
                    return new RawResponse(200, "<html>bad gateway</html>");
                case "offline":
                    throw new TransportException("connection refused");
                default:
                    return BatchRetryEngineTest.success(batch);
            }
        });

        appender = new CapturingAppender();
        appender.start();
        traceLogger = (Logger) LogManager.getLogger(ClientConstants.TRACE_LOGGER_NAME);
        traceLogger.addAppender(appender);
    }

    @After
    public void tearDown() {
        traceLogger.removeAppender(appender);
        appender.stop();
    }

    @Test
    public void testSplitRetryAndOutOfGasAreTraced() {
        List<IndexedEmbedding> result = engine.embedBatchResilient(Arrays.asList("a", "flaky"), 2, true);

        assertEquals(1, result.size());
        assertEquals(Arrays.asList(
            "Token limit exceeded by batch of 2 inputs, splitting into batches of 1 and 1",
            "Embedded batch of 1 inputs, received 1 embeddings",
            "Server error on batch of 1 inputs (boom), retrying with 1 gas left",
            "Server error on batch of 1 inputs (boom), retrying with 0 gas left",
            "Out of gas, dropping batch of 1 inputs"), appender.messages);
    }

    @Test
    public void testGiveUpsAreTraced() {
        engine.embedBatchResilient(Arrays.asList("huge"), 1, true);
        engine.embedBatchResilient(Arrays.asList("denied"), 1, true);
        engine.embedBatchResilient(Arrays.asList("garbled"), 1, true);
        engine.embedBatchResilient(Arrays.asList("offline"), 1, true);
        engine.embedBatchResilient(List.of(), 1, true);

        assertEquals(5, appender.messages.size());
        assertTrue(appender.messages.get(0).startsWith("Token limit exceeded by a single input, giving up on it"));
        assertTrue(appender.messages.get(1).startsWith("Unrecognized API error on batch of 1 inputs, giving up"));
        assertTrue(appender.messages.get(1).contains("authentication_error"));
        assertTrue(appender.messages.get(2).startsWith("Could not parse response for batch of 1 inputs"));
        assertTrue(appender.messages.get(3).contains("connection refused"));
        assertEquals("Empty batch, nothing to embed", appender.messages.get(4));
    }

    @Test
    public void testNothingIsTracedWhenDisabled() {
        List<IndexedEmbedding> result = engine.embedBatchResilient(Arrays.asList("a", "flaky", "huge", "denied"), 2, false);

        assertEquals(1, result.size());
        assertTrue(appender.messages.isEmpty());
    }

    private static final class CapturingAppender extends AbstractAppender {
        private final List<String> messages = new CopyOnWriteArrayList<>();

        private CapturingAppender() {
            super("capture", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            messages.add(event.getMessage().getFormattedMessage());
        }
    }
}
