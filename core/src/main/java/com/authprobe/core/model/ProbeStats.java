package com.authprobe.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 파이프라인 런타임 텔레메트리 (스레드 세이프).
 * 자격증명 1건 = 전송 1회 + 재시도 n회. 지연은 백오프 대기를 포함한 근사치.
 */
public final class ProbeStats {
    private final LongAdder credentials = new LongAdder();
    private final LongAdder requests = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();   // 429 로 인한 재시도
    private final LongAdder wallMs = new LongAdder();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    /** 요청 시작. 현재 동시 실행 수를 돌려주고 최대값을 갱신한다. */
    public int enter() {
        int cur = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(cur, Math::max);
        return cur;
    }

    public int exit() {
        return inFlight.decrementAndGet();
    }

    /** 자격증명 1건 처리 완료(응답이든 전송 실패든) */
    public void recordCredential(int retryCount, int rateLimitedCount, long elapsedMs) {
        credentials.increment();
        requests.add(1L + Math.max(0, retryCount));
        retries.add(Math.max(0, retryCount));
        rateLimited.add(Math.max(0, rateLimitedCount));
        wallMs.add(Math.max(0, elapsedMs));
    }

    public Snapshot snapshot() {
        long req = requests.sum();
        long avg = req == 0 ? 0 : wallMs.sum() / req; // 전송 1회당
        return new Snapshot(credentials.sum(), req, retries.sum(), rateLimited.sum(), maxInFlight.get(), avg);
    }

    public record Snapshot(long credentialsTotal,
                           long requestsTotal,
                           long retriesTotal,
                           long rateLimitedTotal,
                           int maxObservedConcurrency,
                           long avgLatencyMs) {}
}
