package com.authprobe.core.api;

/** 요청 1건의 전송 실패(타임아웃, 연결 거부, DNS 실패 등). 시도 단위로 복구된다. */
public class TransportException extends Exception {
    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
