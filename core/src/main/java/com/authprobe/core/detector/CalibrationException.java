package com.authprobe.core.detector;

/** 시그니처를 만들 수 없음(치명적). 후보 테스트 시작 전에 실행을 중단시킨다. */
public class CalibrationException extends Exception {
    private static final long serialVersionUID = 1L;

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
