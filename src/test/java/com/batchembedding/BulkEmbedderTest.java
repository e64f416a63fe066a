package com.batchembedding;

import com.batchembedding.EmbeddingFailureException.FailureKind;
import com.batchembedding.transport.EmbeddingTransport;
import com.batchembedding.transport.RawResponse;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

public class BulkEmbedderTest {

    private EmbeddingTransport transport;
    private BatchRetryEngine engine;

    @Before
    public void setUp() {
        transport = mock(EmbeddingTransport.class);
        engine = new BatchRetryEngine(transport, SessionContext.of("sk-test"));
    }

    @Test
    public void testIndicesArePositionsInFullInput() throws Exception {
        when(transport.send(anyList(), any(SessionContext.class))).thenAnswer(invocation ->
            BatchRetryEngineTest.success(invocation.getArgument(0)));
        BulkEmbedder embedder = new BulkEmbedder(engine, 2, 3, false);

        List<IndexedEmbedding> result = embedder.embedAll(Arrays.asList("a", "b", "c", "d", "e"));

        assertEquals(5, result.size());
        for (int i = 0; i < result.size(); i++) {
            assertEquals(i, result.get(i).getIndex());
            assertEquals(Float.valueOf('a' + i), result.get(i).getVector().get(0));
        }
        verify(transport, times(3)).send(anyList(), any(SessionContext.class));
    }

    @Test
    public void testDroppedInputsLeaveGaps() throws Exception {
        when(transport.send(anyList(), any(SessionContext.class))).thenAnswer(invocation -> {
            List<String> batch = invocation.getArgument(0);
            return batch.contains("huge")
                ? BatchRetryEngineTest.error("invalid_request_error")
                : BatchRetryEngineTest.success(batch);
        });
        BulkEmbedder embedder = new BulkEmbedder(engine, 3, 3, false);

        List<IndexedEmbedding> result = embedder.embedAll(Arrays.asList("a", "b", "c", "huge", "e"));

        assertEquals(4, result.size());
        assertEquals(Arrays.asList(0, 1, 2, 4),
            Arrays.asList(result.get(0).getIndex(), result.get(1).getIndex(), result.get(2).getIndex(), result.get(3).getIndex()));
    }

    @Test
    public void testStrictModeFailsOnFirstBadBatch() throws Exception {
        when(transport.send(anyList(), any(SessionContext.class)))
            .thenAnswer(invocation -> BatchRetryEngineTest.success(invocation.getArgument(0)))
            .thenReturn(BatchRetryEngineTest.error("server error"));
        BulkEmbedder embedder = new BulkEmbedder(engine, 2, 3, false);

        EmbeddingFailureException e = assertThrows(EmbeddingFailureException.class,
            () -> embedder.embedAllStrict(Arrays.asList("a", "b", "c", "d", "e")));

        assertEquals(FailureKind.SERVER_ERROR, e.getKind());
        verify(transport, times(2)).send(anyList(), any(SessionContext.class));
    }

    @Test
    public void testStrictModeRebasesIndices() throws Exception {
        when(transport.send(anyList(), any(SessionContext.class))).thenAnswer(invocation ->
            BatchRetryEngineTest.success(invocation.getArgument(0)));
        BulkEmbedder embedder = new BulkEmbedder(engine, 2, 3, false);

        List<IndexedEmbedding> result = embedder.embedAllStrict(Arrays.asList("a", "b", "c"));

        assertEquals(2, result.get(2).getIndex());
        assertEquals(Float.valueOf('c'), result.get(2).getVector().get(0));
    }

    @Test
    public void testStrictModeDropsIndicesOutsideTheBatch() throws Exception {
        when(transport.send(anyList(), any(SessionContext.class)))
            .thenReturn(new RawResponse(200, "{\"data\":[{\"index\":0,\"embedding\":[1]},{\"index\":5,\"embedding\":[2]}]}"))
            .thenAnswer(invocation -> BatchRetryEngineTest.success(invocation.getArgument(0)));
        BulkEmbedder embedder = new BulkEmbedder(engine, 2, 3, false);

        List<IndexedEmbedding> result = embedder.embedAllStrict(Arrays.asList("a", "b", "c", "d"));

        assertEquals(3, result.size());
        assertEquals(Arrays.asList(0, 2, 3),
            Arrays.asList(result.get(0).getIndex(), result.get(1).getIndex(), result.get(2).getIndex()));
        assertEquals(Float.valueOf(1f), result.get(0).getVector().get(0));
    }

    @Test
    public void testNullInputIsRejected() {
        BulkEmbedder embedder = new BulkEmbedder(engine, 2, 3, false);

        assertThrows(IllegalArgumentException.class, () -> embedder.embedAll(Arrays.asList("a", null)));
        verifyNoInteractions(transport);
    }

    @Test
    public void testNonPositiveBatchSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BulkEmbedder(engine, 0, 3, false));
    }
}
