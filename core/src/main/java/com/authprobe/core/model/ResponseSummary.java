package com.authprobe.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** HTTP 교환 1건의 정규화 요약(불변). 스코어러/캘리브레이터 공용 입력. */
public final class ResponseSummary {
    private final int statusCode;
    private final int bodyLength;        // 디코딩된 본문 문자 수
    private final String finalUrl;       // 리다이렉트 추적 후 최종 URL
    private final Set<String> cookieNames;
    private final long elapsedMs;

    private ResponseSummary(Builder b) {
        this.statusCode = b.statusCode;
        this.bodyLength = b.bodyLength;
        this.finalUrl = b.finalUrl;
        this.cookieNames = (b.cookieNames == null)
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(b.cookieNames));
        this.elapsedMs = b.elapsedMs;
    }

    /** 전송 결과를 요약으로 변환. 본문 길이는 문자 기준. */
    public static ResponseSummary of(LoginResponse resp, long elapsedMs) {
        Objects.requireNonNull(resp, "resp");
        return builder()
                .statusCode(resp.getStatusCode())
                .bodyLength(resp.getBody().length())
                .finalUrl(resp.getFinalUrl() == null ? null : resp.getFinalUrl().toString())
                .cookieNames(resp.getCookieNames())
                .elapsedMs(elapsedMs)
                .build();
    }

    public int getStatusCode() { return statusCode; }
    public int getBodyLength() { return bodyLength; }
    public String getFinalUrl() { return finalUrl; }
    public Set<String> getCookieNames() { return cookieNames; }
    public long getElapsedMs() { return elapsedMs; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseSummary that)) return false;
        return statusCode == that.statusCode
                && bodyLength == that.bodyLength
                && elapsedMs == that.elapsedMs
                && Objects.equals(finalUrl, that.finalUrl)
                && cookieNames.equals(that.cookieNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statusCode, bodyLength, finalUrl, cookieNames, elapsedMs);
    }

    @Override
    public String toString() {
        return "ResponseSummary{status=" + statusCode + ", length=" + bodyLength
                + ", url=" + finalUrl + ", cookies=" + cookieNames + ", elapsedMs=" + elapsedMs + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int statusCode;
        private int bodyLength;
        private String finalUrl;
        private Set<String> cookieNames;
        private long elapsedMs;

        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder bodyLength(int bodyLength) { this.bodyLength = bodyLength; return this; }
        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder cookieNames(Set<String> cookieNames) { this.cookieNames = cookieNames; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }

        public ResponseSummary build() {
            if (bodyLength < 0) throw new IllegalArgumentException("bodyLength must be >= 0");
            return new ResponseSummary(this);
        }
    }
}
