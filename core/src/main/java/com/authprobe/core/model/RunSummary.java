package com.authprobe.core.model;

import java.time.Duration;

/**
 * 파이프라인 1회 실행의 집계 스냅샷(불변).
 * listenerFailures: 판정 리스너(히트 파일 기록 등)가 실패한 횟수. 0 이 아니면 히트 파일이 불완전할 수 있다.
 */
public record RunSummary(long tested, long suspect, long transportErrors, long faults,
                         long listenerFailures, Duration elapsed) {

    public static RunSummary empty() {
        return new RunSummary(0, 0, 0, 0, 0, Duration.ZERO);
    }

    /** 초당 처리 건수(경과 0이면 0.0) */
    public double throughputPerSecond() {
        long ms = elapsed == null ? 0 : elapsed.toMillis();
        return ms <= 0 ? 0.0 : tested * 1000.0 / ms;
    }
}
