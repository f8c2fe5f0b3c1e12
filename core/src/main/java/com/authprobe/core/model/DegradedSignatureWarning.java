package com.authprobe.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 캘리브레이션 샘플이 한 차원에서 일치하지 않을 때 붙는 경고(예외 아님).
 * 실행 시작 시 한 번 보고되고, 이후 모든 Verdict 메타데이터로 전달된다.
 */
public final class DegradedSignatureWarning {

    public enum Dimension { STATUS, URL }

    private final Dimension dimension;
    private final List<String> observed;   // 샘플에서 관측된 값(순서 유지)

    public DegradedSignatureWarning(Dimension dimension, List<String> observed) {
        this.dimension = Objects.requireNonNull(dimension, "dimension");
        this.observed = (observed == null) ? List.of() : List.copyOf(observed);
    }

    public Dimension getDimension() { return dimension; }
    public List<String> getObserved() { return observed; }

    public String message() {
        return dimension.name().toLowerCase(java.util.Locale.ROOT)
                + " varied across calibration samples " + observed + "; dimension excluded from scoring";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DegradedSignatureWarning w)) return false;
        return dimension == w.dimension && observed.equals(w.observed);
    }

    @Override
    public int hashCode() { return Objects.hash(dimension, observed); }

    @Override
    public String toString() { return message(); }
}
