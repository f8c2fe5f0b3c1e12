package com.authprobe.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * "실패한 로그인"의 허용 오차 포함 서술. PatternAnalyzer가 1회 생성하고
 * 이후 모든 워커가 읽기 전용으로 공유한다(불변 → 락 불필요).
 *
 * 불변식: lengthLow <= lengthHigh.
 */
public final class FailureSignature {
    private final int expectedStatus;
    private final int lengthLow;
    private final int lengthHigh;
    private final String expectedUrl;
    private final double toleranceRatio;
    private final boolean statusReliable;
    private final boolean urlReliable;
    private final int sampleSize;
    private final List<DegradedSignatureWarning> warnings;

    private FailureSignature(Builder b) {
        this.expectedStatus = b.expectedStatus;
        this.lengthLow = b.lengthLow;
        this.lengthHigh = b.lengthHigh;
        this.expectedUrl = b.expectedUrl;
        this.toleranceRatio = b.toleranceRatio;
        this.statusReliable = b.statusReliable;
        this.urlReliable = b.urlReliable;
        this.sampleSize = b.sampleSize;
        this.warnings = List.copyOf(b.warnings);
    }

    public int getExpectedStatus() { return expectedStatus; }
    public int getLengthLow() { return lengthLow; }
    public int getLengthHigh() { return lengthHigh; }
    public String getExpectedUrl() { return expectedUrl; }
    public double getToleranceRatio() { return toleranceRatio; }
    public boolean isStatusReliable() { return statusReliable; }
    public boolean isUrlReliable() { return urlReliable; }
    public int getSampleSize() { return sampleSize; }
    public List<DegradedSignatureWarning> getWarnings() { return warnings; }

    public boolean lengthWithinBand(int length) {
        return length >= lengthLow && length <= lengthHigh;
    }

    public SignatureQuality quality() {
        if (statusReliable && urlReliable) return SignatureQuality.FULL;
        if (!statusReliable && !urlReliable) return SignatureQuality.LENGTH_ONLY;
        return SignatureQuality.PARTIAL;
    }

    public boolean isDegraded() {
        return quality() != SignatureQuality.FULL;
    }

    @Override
    public String toString() {
        return "FailureSignature{status=" + expectedStatus + (statusReliable ? "" : "(unreliable)")
                + ", length=[" + lengthLow + "," + lengthHigh + "]"
                + ", url=" + expectedUrl + (urlReliable ? "" : "(unreliable)")
                + ", tolerance=" + toleranceRatio + ", samples=" + sampleSize + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int expectedStatus;
        private int lengthLow;
        private int lengthHigh;
        private String expectedUrl;
        private double toleranceRatio = 0.01;
        private boolean statusReliable = true;
        private boolean urlReliable = true;
        private int sampleSize;
        private final List<DegradedSignatureWarning> warnings = new ArrayList<>();

        public Builder expectedStatus(int v) { this.expectedStatus = v; return this; }
        public Builder lengthRange(int low, int high) { this.lengthLow = low; this.lengthHigh = high; return this; }
        public Builder expectedUrl(String v) { this.expectedUrl = v; return this; }
        public Builder toleranceRatio(double v) { this.toleranceRatio = v; return this; }
        public Builder statusReliable(boolean v) { this.statusReliable = v; return this; }
        public Builder urlReliable(boolean v) { this.urlReliable = v; return this; }
        public Builder sampleSize(int v) { this.sampleSize = v; return this; }
        public Builder warning(DegradedSignatureWarning w) { this.warnings.add(Objects.requireNonNull(w, "w")); return this; }

        public FailureSignature build() {
            if (lengthLow < 0) throw new IllegalArgumentException("lengthLow must be >= 0");
            if (lengthLow > lengthHigh) {
                throw new IllegalArgumentException("lengthLow > lengthHigh: " + lengthLow + " > " + lengthHigh);
            }
            if (toleranceRatio < 0) throw new IllegalArgumentException("toleranceRatio must be >= 0");
            return new FailureSignature(this);
        }
    }
}
