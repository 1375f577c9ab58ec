package io.layoffs.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {
    @Test
    void doubles_delay_up_to_the_cap() {
        var policy = new ExponentialBackoffRetryPolicy(10, 5, 30);
        assertEquals(5, policy.backoffMillis(1));
        assertEquals(10, policy.backoffMillis(2));
        assertEquals(20, policy.backoffMillis(3));
        assertEquals(30, policy.backoffMillis(4));
        assertEquals(30, policy.backoffMillis(50));
    }

    @Test
    void retries_checked_failures_until_max_attempts() {
        var policy = new ExponentialBackoffRetryPolicy(3, 1, 10);
        assertTrue(policy.shouldRetry(1, new IOException("x")));
        assertTrue(policy.shouldRetry(2, new IOException("x")));
        assertFalse(policy.shouldRetry(3, new IOException("x")));
    }

    @Test
    void never_retries_runtime_failures() {
        var policy = new ExponentialBackoffRetryPolicy(3, 1, 10);
        assertFalse(policy.shouldRetry(1, new IllegalStateException("bug")));
        assertFalse(RetryPolicy.NEVER.shouldRetry(1, new IOException("x")));
    }
}
