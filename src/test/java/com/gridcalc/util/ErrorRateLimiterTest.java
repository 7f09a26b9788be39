package com.gridcalc.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testThrottlesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        assertTrue(limiter.log("first", new RuntimeException("first")));
        for (int i = 0; i < 5; i++)
            assertFalse(limiter.log("again", null));
        assertEquals(5, limiter.suppressedCount());
    }

    @Test
    public void testZeroIntervalLogsEverything() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 0);
        assertTrue(limiter.log("one", null));
        Thread.sleep(1);
        assertTrue(limiter.log("two", null));
        assertEquals(0, limiter.suppressedCount());
    }

    @Test
    public void testSuppressedCountResetsAfterNextLog() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 20);
        assertTrue(limiter.log("one", null));
        assertFalse(limiter.log("dropped", null));
        Thread.sleep(50);
        assertTrue(limiter.log("three", null));
        assertEquals(0, limiter.suppressedCount());
    }
}
