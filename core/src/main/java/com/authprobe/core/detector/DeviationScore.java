package com.authprobe.core.detector;

import java.util.List;

/** 스코어링 결과: 합산 점수 + 기여 사유(평가 순서) + 열화 모드 여부. */
public record DeviationScore(int points, List<String> reasons, boolean degraded) {

    public DeviationScore {
        reasons = (reasons == null) ? List.of() : List.copyOf(reasons);
    }

    public static DeviationScore zero() {
        return new DeviationScore(0, List.of(), false);
    }
}
