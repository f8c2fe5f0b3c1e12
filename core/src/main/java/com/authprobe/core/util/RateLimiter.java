package com.authprobe.core.util;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * 전역 토큰 버킷. 워커별 페이싱과 별개로 모든 워커를 합친 초당 요청 상한을 건다.
 * 토큰이 없으면 다음 토큰까지 남은 시간만큼(최대 50ms 단위) 기다리며 중단 신호를 확인한다.
 */
public final class RateLimiter {

    private static final long MAX_WAIT_SLICE_MS = 50;

    private final long capacity;
    private final long refillPerSecond;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime);
    }

    RateLimiter(long capacity, long refillPerSecond, LongSupplier nanoClock) {
        if (capacity < 1 || refillPerSecond < 1) throw new IllegalArgumentException("rate must be >= 1");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastNs = nanoClock.getAsLong();
    }

    /** 초당 rps, 버스트 1. rps <= 0 이면 null(제한 없음). */
    public static RateLimiter perSecondOrNull(int rps) {
        return rps <= 0 ? null : new RateLimiter(1, rps);
    }

    /** 토큰을 얻으면 true, 대기 중 중단 신호가 서면 false. */
    public synchronized boolean acquire(BooleanSupplier stopped) throws InterruptedException {
        for (;;) {
            if (stopped.getAsBoolean()) return false;
            if (tryTake()) return true;
            long waitMs = Math.max(1, Math.min(MAX_WAIT_SLICE_MS, TimeUnit.NANOSECONDS.toMillis(nanosUntilToken())));
            this.wait(waitMs);
        }
    }

    /** 대기 없이 토큰 1개 시도 */
    synchronized boolean tryTake() {
        refill();
        if (tokens < 1.0) return false;
        tokens -= 1.0;
        return true;
    }

    private long nanosUntilToken() {
        double missing = 1.0 - tokens;
        return missing <= 0 ? 0 : (long) Math.ceil(missing / refillPerSecond * 1_000_000_000L);
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
