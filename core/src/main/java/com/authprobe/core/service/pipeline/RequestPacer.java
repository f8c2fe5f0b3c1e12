package com.authprobe.core.service.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 워커 1개 전용 페이서: 같은 워커의 연속 요청 "시작" 사이 최소 간격을 보장한다.
 * 첫 요청은 바로 나간다. 대기는 StopSignal 위에서 하므로 중단 시 즉시 깬다.
 * 스레드 세이프하지 않음(워커 스레드 1개가 소유).
 */
final class RequestPacer {
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private boolean started = false;
    private long lastStartNanos;

    RequestPacer(Duration interval, LongSupplier nanoClock) {
        this.intervalNanos = (interval == null || interval.isNegative()) ? 0L : interval.toNanos();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * 다음 요청을 시작해도 될 때까지 기다린다.
     * @return 시작 가능하면 true(시작 시각 기록), 중단 신호면 false
     */
    boolean awaitTurn(StopSignal stop) throws InterruptedException {
        if (started && intervalNanos > 0) {
            long wait = lastStartNanos + intervalNanos - nanoClock.getAsLong();
            if (wait > 0 && stop.await(Duration.ofNanos(wait))) return false;
        }
        if (stop.isRaised()) return false;
        started = true;
        lastStartNanos = nanoClock.getAsLong();
        return true;
    }

    long intervalNanos() { return intervalNanos; }
}
