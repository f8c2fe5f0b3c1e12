package com.authprobe.core.http;

import com.authprobe.core.model.ProbeConfig;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 레이트리밋(429), 일시적 과부하(503), 전송 실패만 재시도한다.
 * 500/502 같은 나머지 응답은 로그인 결과의 일부라서 그대로 채점 단계로 넘긴다.
 * 지연: base, base*2, base*4 ... 에 ±10% 지터.
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    static final Set<Integer> RETRYABLE = Set.of(429, 503, TRANSPORT_FAILURE);
    static final long DEFAULT_BASE_MS = 250;

    private final int maxAttempts;
    private final long baseMillis;
    private final DoubleSupplier jitter; // [0, 1)

    public DefaultRetryPolicy() { this(3); }
    public DefaultRetryPolicy(int maxAttempts) { this(maxAttempts, DEFAULT_BASE_MS); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this(maxAttempts, baseMillis, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** 테스트용: 지터 난수 주입 */
    DefaultRetryPolicy(int maxAttempts, long baseMillis, DoubleSupplier jitter) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.jitter = jitter;
    }

    public static DefaultRetryPolicy from(ProbeConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxAttempts());
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        return attempt < maxAttempts && RETRYABLE.contains(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(Math.max(0, attempt - 1), 16);
        double factor = 0.9 + 0.2 * jitter.getAsDouble();
        return Duration.ofMillis((long) ((baseMillis << shift) * factor));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
