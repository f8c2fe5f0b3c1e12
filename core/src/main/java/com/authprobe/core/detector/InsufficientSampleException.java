package com.authprobe.core.detector;

/** 분석할 캘리브레이션 샘플이 없음. */
public class InsufficientSampleException extends CalibrationException {
    private static final long serialVersionUID = 1L;

    public InsufficientSampleException(String message) {
        super(message);
    }
}
