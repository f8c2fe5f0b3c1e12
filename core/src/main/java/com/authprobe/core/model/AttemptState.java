package com.authprobe.core.model;

/**
 * 자격증명 1건의 상태 머신: QUEUED → IN_FLIGHT → SCORED → {REJECTED | SUSPECT}.
 * 역방향 전이 없음. 전송 실패는 IN_FLIGHT → REJECTED(점수 0)로 바로 종결된다.
 */
public enum AttemptState {
    QUEUED,
    IN_FLIGHT,
    SCORED,
    REJECTED,
    SUSPECT;

    public boolean isTerminal() {
        return this == REJECTED || this == SUSPECT;
    }

    public boolean canTransitionTo(AttemptState next) {
        if (next == null) return false;
        return switch (this) {
            case QUEUED -> next == IN_FLIGHT;
            case IN_FLIGHT -> next == SCORED || next == REJECTED;
            case SCORED -> next == REJECTED || next == SUSPECT;
            case REJECTED, SUSPECT -> false;
        };
    }

    /** 허용되지 않는 전이는 IllegalStateException */
    public AttemptState next(AttemptState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("illegal transition " + this + " -> " + next);
        }
        return next;
    }

    public static AttemptState of(Classification c) {
        return c == Classification.SUSPECT ? SUSPECT : REJECTED;
    }
}
