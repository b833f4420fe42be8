package com.work.lock.core.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class LockOptionsTest {

    @Test
    public void defaults_apply_when_only_key_given() {
        LockOptions options = LockOptions.of("daily-cleanup");

        assertEquals("daily-cleanup", options.getKey());
        assertEquals(60L, options.getTtlSeconds());
        assertEquals(Duration.ofSeconds(60), options.getTtl());
        assertEquals(0, options.getMaxRetries());
        assertEquals(100L, options.getRetryDelayMs());
    }

    @Test
    public void with_retries_keeps_key_and_ttl() {
        LockOptions options = LockOptions.of("hourly-sync", 300).withRetries(3, 250);

        assertEquals(new LockOptions("hourly-sync", 300, 3, 250), options);
    }

    @Test
    public void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> LockOptions.of(""));
        assertThrows(IllegalArgumentException.class, () -> LockOptions.of("has space"));
        assertThrows(IllegalArgumentException.class, () -> LockOptions.of("k", 0));
        assertThrows(IllegalArgumentException.class, () -> new LockOptions("k", 1, -1, 100));
        assertThrows(IllegalArgumentException.class, () -> new LockOptions("k", 1, 0, -1));
    }

    @Test
    public void ttl_is_capped() {
        assertEquals(LockOptions.MAX_TTL_SECONDS, LockOptions.of("k", LockOptions.MAX_TTL_SECONDS).getTtlSeconds());
        assertThrows(IllegalArgumentException.class, () -> LockOptions.of("k", LockOptions.MAX_TTL_SECONDS + 1));
        assertThrows(IllegalArgumentException.class, () -> LockOptions.of("k", Long.MAX_VALUE));
    }
}
