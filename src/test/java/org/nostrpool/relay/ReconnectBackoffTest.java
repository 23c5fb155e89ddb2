package org.nostrpool.relay;

import org.junit.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.Assert.*;

/**
 * Unit tests for reconnect delay calculation.
 */
public class ReconnectBackoffTest {

    @Test
    public void testExponentialBackoffCalculation() {
        RelayOptions options = RelayOptions.builder()
                .reconnectInterval(Duration.ofSeconds(1))
                .maxReconnectInterval(Duration.ofSeconds(30))
                .jitter(false)
                .build();
        ReconnectBackoff backoff = new ReconnectBackoff(options);

        assertEquals(1000, backoff.nextDelayMillis());  // 1s
        assertEquals(2000, backoff.nextDelayMillis());  // 2s
        assertEquals(4000, backoff.nextDelayMillis());  // 4s
        assertEquals(8000, backoff.nextDelayMillis());  // 8s
        assertEquals(16000, backoff.nextDelayMillis()); // 16s
        assertEquals(30000, backoff.nextDelayMillis()); // capped at 30s
        assertEquals(30000, backoff.nextDelayMillis()); // still capped
        assertEquals(7, backoff.getAttempts());
    }

    @Test
    public void testResetStartsOver() {
        RelayOptions options = RelayOptions.builder().jitter(false).build();
        ReconnectBackoff backoff = new ReconnectBackoff(options);

        backoff.nextDelayMillis();
        backoff.nextDelayMillis();
        backoff.reset();

        assertEquals(0, backoff.getAttempts());
        assertEquals(1000, backoff.nextDelayMillis());
    }

    @Test
    public void testCustomMultiplier() {
        RelayOptions options = RelayOptions.builder()
                .reconnectInterval(Duration.ofMillis(100))
                .maxReconnectInterval(Duration.ofSeconds(10))
                .backoffMultiplier(3.0)
                .jitter(false)
                .build();
        ReconnectBackoff backoff = new ReconnectBackoff(options);

        assertEquals(100, backoff.nextDelayMillis());
        assertEquals(300, backoff.nextDelayMillis());
        assertEquals(900, backoff.nextDelayMillis());
    }

    @Test
    public void testJitterStaysWithinHalfAndFullDelay() {
        RelayOptions options = RelayOptions.builder()
                .reconnectInterval(Duration.ofSeconds(1))
                .maxReconnectInterval(Duration.ofSeconds(30))
                .build();
        Random random = new Random(42);

        for (int run = 0; run < 50; run++) {
            ReconnectBackoff backoff = new ReconnectBackoff(options, random);
            long expected = 1000;
            for (int attempt = 0; attempt < 8; attempt++) {
                long delay = backoff.nextDelayMillis();
                long capped = Math.min(expected, 30000);
                assertTrue("delay " + delay + " below half of " + capped, delay >= capped / 2);
                assertTrue("delay " + delay + " above " + capped, delay <= capped);
                expected *= 2;
            }
        }
    }

    @Test
    public void testBaseFromCallerReplacesConfiguredBase() {
        RelayOptions options = RelayOptions.builder().jitter(false).build();
        ReconnectBackoff backoff = new ReconnectBackoff(options);

        assertEquals(5000, backoff.nextDelayMillis(5000));
        assertEquals(10000, backoff.nextDelayMillis(5000));
        assertEquals(30000, backoff.nextDelayMillis(20000)); // capped
    }

    @Test
    public void testAdjustBaseBySuccessRatio() {
        assertEquals(1000, ReconnectBackoff.adjustBase(1000, 0, 0));   // never tried
        assertEquals(1000, ReconnectBackoff.adjustBase(1000, 4, 4));   // always connected
        assertEquals(2000, ReconnectBackoff.adjustBase(1000, 4, 2));   // half failed
        assertEquals(4000, ReconnectBackoff.adjustBase(1000, 8, 2));
        assertEquals(10000, ReconnectBackoff.adjustBase(1000, 3, 0));  // never connected
        assertEquals(10000, ReconnectBackoff.adjustBase(1000, 50, 1)); // floor on the ratio
    }

    @Test
    public void testAdjustRetryIntervalDefaultsOn() {
        assertTrue(RelayOptions.defaults().isAdjustRetryInterval());
        assertFalse(RelayOptions.builder().adjustRetryInterval(false).build().isAdjustRetryInterval());
    }

    @Test
    public void testInvalidOptions() {
        try {
            RelayOptions.builder().reconnectInterval(Duration.ZERO).build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            RelayOptions.builder()
                    .reconnectInterval(Duration.ofSeconds(10))
                    .maxReconnectInterval(Duration.ofSeconds(5))
                    .build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            RelayOptions.builder().backoffMultiplier(0.5).build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
