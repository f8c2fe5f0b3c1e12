package com.authprobe.core.model;

/** 캘리브레이션 품질: 신뢰 가능한 차원 수에 따라 스코어링 방식이 달라진다. */
public enum SignatureQuality {
    /** status/length/url 모두 사용 */
    FULL,
    /** status 또는 url 중 하나가 흔들림 → 해당 가중치를 나머지에 재분배 */
    PARTIAL,
    /** status/url 모두 흔들림 → 길이 단독 스코어링 */
    LENGTH_ONLY
}
