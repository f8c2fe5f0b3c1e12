package com.authprobe.core.http;

import java.time.Duration;

/**
 * 로그인 시도 1건의 재시도 판단.
 * 전송 실패(연결 거부, 타임아웃 등)는 상태 코드 {@link #TRANSPORT_FAILURE} 로 들어온다.
 */
public interface RetryPolicy {

    int TRANSPORT_FAILURE = -1;

    /** attempt 는 방금 끝난 시도 번호(1부터). true 면 대기 후 같은 자격증명을 다시 보낸다. */
    boolean shouldRetry(int statusCode, int attempt);

    /** 서버 힌트가 없을 때의 대기 시간 */
    Duration nextDelay(int attempt);

    /** 첫 시도를 포함한 최대 전송 횟수 */
    int maxAttempts();

    /** Retry-After 로 허용하는 최대 대기 */
    default Duration retryAfterCap() {
        return Duration.ofSeconds(30);
    }

    /**
     * 실제로 기다릴 시간. 초 단위 Retry-After 가 있으면 그 값(상한 적용),
     * 없거나 HTTP-date 형식이면 {@link #nextDelay(int)}.
     */
    default Duration delayFor(int attempt, String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) return nextDelay(attempt);
        try {
            long sec = Long.parseLong(retryAfter.trim());
            Duration hinted = Duration.ofSeconds(Math.max(0, sec));
            Duration cap = retryAfterCap();
            return hinted.compareTo(cap) > 0 ? cap : hinted;
        } catch (NumberFormatException e) {
            return nextDelay(attempt);
        }
    }
}
