package com.authprobe.core.detector;

import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ProbeConfig;

/**
 * 가중치/임계값 설정. 기본 3/2/3, 임계 3은 경험값이므로 대상별로 조정 가능해야 한다.
 *
 * <p>시그니처 품질에 따라 실효 가중치가 달라진다:
 * <ul>
 *   <li>FULL: 설정값 그대로</li>
 *   <li>PARTIAL: 흔들린 차원(status 또는 url)의 가중치를 나머지 두 차원에 비례 재분배, 총합 유지</li>
 *   <li>LENGTH_ONLY: 길이에 총합 전부</li>
 * </ul>
 */
public final class ScoringPolicy {

    public static final ScoringPolicy DEFAULT = new ScoringPolicy(3, 2, 3, 3);

    private final int weightStatus;
    private final int weightLength;
    private final int weightUrl;
    private final int threshold;

    public ScoringPolicy(int weightStatus, int weightLength, int weightUrl, int threshold) {
        if (weightStatus < 0 || weightLength < 0 || weightUrl < 0) {
            throw new IllegalArgumentException("weights must be >= 0");
        }
        if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
        this.weightStatus = weightStatus;
        this.weightLength = weightLength;
        this.weightUrl = weightUrl;
        this.threshold = threshold;
    }

    public static ScoringPolicy from(ProbeConfig cfg) {
        return new ScoringPolicy(cfg.getWeightStatus(), cfg.getWeightLength(), cfg.getWeightUrl(),
                cfg.getScoreThreshold());
    }

    public int getWeightStatus() { return weightStatus; }
    public int getWeightLength() { return weightLength; }
    public int getWeightUrl() { return weightUrl; }
    public int getThreshold() { return threshold; }

    /** 세 차원 가중치 합(기본 8) = 최대 점수 */
    public int totalWeight() {
        return weightStatus + weightLength + weightUrl;
    }

    /** 실효 가중치(사용 안 하는 차원은 0) */
    public record Weights(int status, int length, int url) {}

    public Weights effectiveWeights(FailureSignature sig) {
        final int total = totalWeight();
        return switch (sig.quality()) {
            case FULL -> new Weights(weightStatus, weightLength, weightUrl);
            case LENGTH_ONLY -> new Weights(0, total, 0);
            case PARTIAL -> sig.isStatusReliable()
                    ? redistribute(total, weightStatus, weightLength, false)
                    : redistribute(total, weightUrl, weightLength, true);
        };
    }

    /** keep(=status 또는 url)와 length에 total을 비례 배분. 둘 다 0이면 재분배 없음. */
    private Weights redistribute(int total, int keep, int length, boolean keepIsUrl) {
        int base = keep + length;
        int newLength;
        int newKeep;
        if (base == 0) {
            newLength = length;
            newKeep = keep;
        } else {
            newLength = (int) Math.round((double) length * total / base);
            newKeep = total - newLength;
        }
        return keepIsUrl ? new Weights(0, newLength, newKeep) : new Weights(newKeep, newLength, 0);
    }

    @Override
    public String toString() {
        return "ScoringPolicy{status=" + weightStatus + ", length=" + weightLength
                + ", url=" + weightUrl + ", threshold=" + threshold + "}";
    }
}
