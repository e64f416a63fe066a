package com.batchembedding;

import org.junit.Test;

import static org.junit.Assert.*;

public class BackoffStrategyTest {

    @Test
    public void testDelayGrowsAndIsCapped() {
        BackoffStrategy backoff = new BackoffStrategy(1000L, 5000L, 2.0);

        assertEquals(1000L, backoff.delayFor(0));
        assertEquals(2000L, backoff.delayFor(1));
        assertEquals(4000L, backoff.delayFor(2));
        assertEquals(5000L, backoff.delayFor(3));
        assertEquals(5000L, backoff.delayFor(30));
    }

    @Test
    public void testNoneNeverWaits() {
        BackoffStrategy backoff = BackoffStrategy.none();

        assertEquals(0L, backoff.delayFor(0));
        assertEquals(0L, backoff.delayFor(10));
    }

    @Test
    public void testInvalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffStrategy(-1L, 10L, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new BackoffStrategy(1L, 10L, 0.5));
    }
}
