package com.authprobe.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** 로그인 POST 응답 캡처(본문은 텍스트 기준). 전송 계층이 만들어 워커에 넘긴다. */
public final class LoginResponse {
    private final URI finalUrl;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final Set<String> cookieNames;

    private LoginResponse(Builder b) {
        this.finalUrl = b.finalUrl;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.cookieNames = (b.cookieNames == null)
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(b.cookieNames));
    }

    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public Set<String> getCookieNames() { return cookieNames; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private Set<String> cookieNames;

        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder cookieNames(Set<String> cookieNames) { this.cookieNames = cookieNames; return this; }

        public LoginResponse build() {
            Objects.requireNonNull(finalUrl, "finalUrl");
            return new LoginResponse(this);
        }
    }
}
