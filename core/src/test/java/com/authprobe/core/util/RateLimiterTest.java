package com.authprobe.core.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class RateLimiterTest {

    @Test
    void tokens_refill_at_configured_rate() {
        AtomicLong now = new AtomicLong(0);
        RateLimiter rl = new RateLimiter(1, 5, now::get); // 초당 5토큰, 버스트 1

        assertTrue(rl.tryTake(), "initial token");
        assertFalse(rl.tryTake(), "bucket empty right after");

        now.addAndGet(150_000_000L); // 150ms → 0.75 토큰
        assertFalse(rl.tryTake());
        now.addAndGet(100_000_000L); // 250ms 누적 → 1 토큰(상한)
        assertTrue(rl.tryTake());
    }

    @Test
    void burst_never_exceeds_capacity() {
        AtomicLong now = new AtomicLong(0);
        RateLimiter rl = new RateLimiter(2, 10, now::get);
        now.addAndGet(10_000_000_000L); // 한참 쉬어도 최대 2개
        assertTrue(rl.tryTake());
        assertTrue(rl.tryTake());
        assertFalse(rl.tryTake());
    }

    @Test
    void acquire_waits_for_real_clock_refill() throws Exception {
        RateLimiter rl = new RateLimiter(1, 20); // 50ms 간격
        long t0 = System.nanoTime();
        assertTrue(rl.acquire(() -> false));
        assertTrue(rl.acquire(() -> false));
        long ms = (System.nanoTime() - t0) / 1_000_000;
        assertTrue(ms >= 40, "second acquire should wait ~50ms, waited " + ms + "ms");
    }

    @Test
    void zero_or_negative_rps_means_unlimited() {
        assertNull(RateLimiter.perSecondOrNull(0));
        assertNull(RateLimiter.perSecondOrNull(-3));
        assertNotNull(RateLimiter.perSecondOrNull(1));
    }

    @Test
    void stopped_wait_returns_false_without_token() throws Exception {
        RateLimiter rl = new RateLimiter(1, 1);
        assertTrue(rl.acquire(() -> false));       // 초기 토큰
        assertFalse(rl.acquire(() -> true));       // 중단 신호
    }

    @Test
    void invalid_rates_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(1, 0));
    }
}
