package com.authprobe.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 자격증명 1건의 판정 결과(불변). 결과 싱크에 append 되고 SUSPECT면 즉시 영속화된다. */
public final class Verdict {
    private final String username;
    private final String password;
    private final int score;
    private final List<String> reasons;        // 점수 기여 사유(평가 순서 유지)
    private final ResponseSummary summary;     // 전송 실패 시 null
    private final Classification classification;
    private final List<String> warnings;       // 시그니처 열화 메타데이터
    private final String transportError;       // nullable
    private final String worker;
    private final Instant decidedAt;

    private Verdict(Builder b) {
        this.username = b.username;
        this.password = b.password;
        this.score = b.score;
        this.reasons = (b.reasons == null) ? List.of() : List.copyOf(b.reasons);
        this.summary = b.summary;
        this.classification = b.classification;
        this.warnings = (b.warnings == null) ? List.of() : List.copyOf(b.warnings);
        this.transportError = b.transportError;
        this.worker = b.worker;
        this.decidedAt = (b.decidedAt == null ? Instant.now() : b.decidedAt);
    }

    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getScore() { return score; }
    public List<String> getReasons() { return reasons; }
    public ResponseSummary getSummary() { return summary; }
    public Classification getClassification() { return classification; }
    public List<String> getWarnings() { return warnings; }
    public String getTransportError() { return transportError; }
    public String getWorker() { return worker; }
    public Instant getDecidedAt() { return decidedAt; }

    public boolean isSuspect() { return classification == Classification.SUSPECT; }
    public boolean isTransportFailure() { return transportError != null; }

    @Override
    public String toString() {
        return "Verdict{" + username + ":***, " + classification + ", score=" + score + ", reasons=" + reasons + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String username;
        private String password;
        private int score;
        private List<String> reasons;
        private ResponseSummary summary;
        private Classification classification;
        private List<String> warnings;
        private String transportError;
        private String worker;
        private Instant decidedAt;

        public Builder credential(Credential c) {
            this.username = c.username();
            this.password = c.password();
            return this;
        }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder score(int score) { this.score = score; return this; }
        public Builder reasons(List<String> reasons) { this.reasons = reasons; return this; }
        public Builder summary(ResponseSummary summary) { this.summary = summary; return this; }
        public Builder classification(Classification c) { this.classification = c; return this; }
        public Builder warnings(List<String> warnings) { this.warnings = warnings; return this; }
        public Builder transportError(String transportError) { this.transportError = transportError; return this; }
        public Builder worker(String worker) { this.worker = worker; return this; }
        public Builder decidedAt(Instant decidedAt) { this.decidedAt = decidedAt; return this; }

        public Verdict build() {
            Objects.requireNonNull(username, "username");
            Objects.requireNonNull(password, "password");
            Objects.requireNonNull(classification, "classification");
            if (summary == null && transportError == null) {
                throw new IllegalStateException("verdict needs a response summary or a transport error");
            }
            return new Verdict(this);
        }
    }
}
