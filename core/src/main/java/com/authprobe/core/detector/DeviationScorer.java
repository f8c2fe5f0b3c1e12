package com.authprobe.core.detector;

import com.authprobe.core.model.Classification;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ResponseSummary;
import com.authprobe.core.model.SignatureQuality;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 라이브 응답 1건을 실패 시그니처와 비교해 가중 점수와 사유를 만든다.
 * 순수 함수(부작용 없음)이며 예외를 던지지 않는다: 누락 필드는 0점.
 */
public final class DeviationScorer {

    static final String DEGRADED_REASON =
            "degraded calibration: status and URL varied across calibration samples; scoring on length only";

    private final ScoringPolicy policy;

    public DeviationScorer(ScoringPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public DeviationScorer() {
        this(ScoringPolicy.DEFAULT);
    }

    public ScoringPolicy getPolicy() { return policy; }

    public DeviationScore score(ResponseSummary summary, FailureSignature sig) {
        if (summary == null || sig == null) return DeviationScore.zero();

        final ScoringPolicy.Weights w = policy.effectiveWeights(sig);
        final boolean lengthOnly = sig.quality() == SignatureQuality.LENGTH_ONLY;
        final List<String> reasons = new ArrayList<>(4);
        int points = 0;

        // 1) 상태 코드
        if (w.status() > 0 && summary.getStatusCode() > 0
                && summary.getStatusCode() != sig.getExpectedStatus()) {
            points += w.status();
            reasons.add("status changed: expected " + sig.getExpectedStatus() + ", was " + summary.getStatusCode());
        }

        // 2) 본문 길이
        if (w.length() > 0 && !sig.lengthWithinBand(summary.getBodyLength())) {
            points += w.length();
            reasons.add("length anomaly: " + summary.getBodyLength() + " bytes (expected "
                    + sig.getLengthLow() + "-" + sig.getLengthHigh() + ")");
        }

        // 3) 최종 URL(리다이렉트)
        String url = summary.getFinalUrl();
        String expected = sig.getExpectedUrl();
        if (w.url() > 0 && url != null && expected != null && !url.equals(expected)) {
            points += w.url();
            reasons.add("redirected: expected " + expected + ", got " + url);
        }

        if (lengthOnly) reasons.add(DEGRADED_REASON);
        return new DeviationScore(points, reasons, lengthOnly);
    }

    public Classification classify(int points) {
        return points >= policy.getThreshold() ? Classification.SUSPECT : Classification.REJECTED;
    }

    public Classification classify(DeviationScore score) {
        return classify(score.points());
    }
}
