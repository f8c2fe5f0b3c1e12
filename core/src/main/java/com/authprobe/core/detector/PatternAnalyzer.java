package com.authprobe.core.detector;

import com.authprobe.core.model.DegradedSignatureWarning;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.model.ResponseSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 캘리브레이션 샘플을 허용 오차 포함 실패 시그니처로 축약한다.
 * 결정적: 같은 샘플 순서 → 항상 같은 시그니처(동률은 먼저 관측된 값).
 */
public final class PatternAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PatternAnalyzer.class);

    private final double toleranceRatio;
    private final int minLengthMargin;

    public PatternAnalyzer(double toleranceRatio, int minLengthMargin) {
        if (!(toleranceRatio >= 0) || Double.isInfinite(toleranceRatio))
            throw new IllegalArgumentException("toleranceRatio must be a finite value >= 0, was " + toleranceRatio);
        if (minLengthMargin < 0) throw new IllegalArgumentException("minLengthMargin must be >= 0");
        this.toleranceRatio = toleranceRatio;
        this.minLengthMargin = minLengthMargin;
    }

    public PatternAnalyzer(double toleranceRatio) {
        this(toleranceRatio, 0);
    }

    public static PatternAnalyzer from(ProbeConfig cfg) {
        return new PatternAnalyzer(cfg.getToleranceRatio(), cfg.getMinLengthMargin());
    }

    public FailureSignature analyze(List<ResponseSummary> summaries) throws InsufficientSampleException {
        if (summaries == null || summaries.isEmpty()) {
            throw new InsufficientSampleException("no calibration samples to analyze");
        }
        for (ResponseSummary s : summaries) Objects.requireNonNull(s, "calibration sample");

        // 1) 상태 코드: 최빈값, 만장일치 아니면 unreliable
        Map<Integer, Integer> statuses = histogram(summaries, ResponseSummary::getStatusCode);
        int expectedStatus = mode(statuses);
        boolean statusReliable = statuses.size() == 1;

        // 2) 길이 밴드: [min, max] ± 비율 여유(+고정 여유)
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (ResponseSummary s : summaries) {
            min = Math.min(min, s.getBodyLength());
            max = Math.max(max, s.getBodyLength());
        }
        // long 으로 계산 후 int 범위로 자른다(큰 고정 여유에서 상한이 음수로 넘치지 않게)
        int low = (int) Math.max(0L, min - margin(min) - minLengthMargin);
        int high = (int) Math.min(Integer.MAX_VALUE, max + margin(max) + minLengthMargin);

        // 3) 최종 URL: 최빈값, 만장일치 아니면 unreliable
        Map<String, Integer> urls = histogram(summaries, ResponseSummary::getFinalUrl);
        String expectedUrl = mode(urls);
        boolean urlReliable = urls.size() == 1;

        FailureSignature.Builder b = FailureSignature.builder()
                .expectedStatus(expectedStatus)
                .lengthRange(low, high)
                .expectedUrl(expectedUrl)
                .toleranceRatio(toleranceRatio)
                .statusReliable(statusReliable)
                .urlReliable(urlReliable)
                .sampleSize(summaries.size());
        if (!statusReliable) {
            b.warning(new DegradedSignatureWarning(DegradedSignatureWarning.Dimension.STATUS,
                    observed(summaries, s -> String.valueOf(s.getStatusCode()))));
        }
        if (!urlReliable) {
            b.warning(new DegradedSignatureWarning(DegradedSignatureWarning.Dimension.URL,
                    observed(summaries, s -> String.valueOf(s.getFinalUrl()))));
        }
        FailureSignature sig = b.build();
        LOG.debug("Signature from {} samples: {}", summaries.size(), sig);
        return sig;
    }

    /** ceil(x * ratio). BigDecimal로 계산해 9300*0.01 같은 값이 94로 튀지 않게 한다. */
    private long margin(int x) {
        return BigDecimal.valueOf(x)
                .multiply(BigDecimal.valueOf(toleranceRatio))
                .setScale(0, RoundingMode.CEILING)
                .min(BigDecimal.valueOf(Integer.MAX_VALUE))
                .longValueExact();
    }

    private static <K> Map<K, Integer> histogram(List<ResponseSummary> xs, Function<ResponseSummary, K> key) {
        Map<K, Integer> counts = new LinkedHashMap<>();
        for (ResponseSummary s : xs) counts.merge(key.apply(s), 1, Integer::sum);
        return counts;
    }

    private static <K> K mode(Map<K, Integer> counts) {
        K best = null;
        int bestCount = -1;
        for (Map.Entry<K, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) { // 엄격 비교 → 동률이면 먼저 관측된 값 유지
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static List<String> observed(List<ResponseSummary> xs, Function<ResponseSummary, String> f) {
        List<String> out = new ArrayList<>(xs.size());
        for (ResponseSummary s : xs) out.add(f.apply(s));
        return out;
    }
}
