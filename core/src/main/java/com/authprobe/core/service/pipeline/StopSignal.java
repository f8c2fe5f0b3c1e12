package com.authprobe.core.service.pipeline;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** 한 번 올리면 내려가지 않는 전역 중단 신호. 대기 중인 페이싱을 즉시 깨운다. */
public final class StopSignal {
    private final AtomicBoolean raised = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);

    /** @return 이번 호출로 처음 올라갔으면 true */
    public boolean raise() {
        if (raised.compareAndSet(false, true)) {
            latch.countDown();
            return true;
        }
        return false;
    }

    public boolean isRaised() {
        return raised.get();
    }

    /**
     * 최대 timeout 동안 신호를 기다린다.
     * @return 신호가 올라가 있으면 true, 시간만 지났으면 false
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return isRaised();
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
