package com.authprobe.core.model;

/** 스코어러 최종 판정 */
public enum Classification {
    /** 실패 시그니처와 일치(거부된 로그인) */
    REJECTED,
    /** 시그니처에서 벗어남(성공 가능성) */
    SUSPECT
}
