package com.duelhub.duelservice.games.duel.domain.exception;

/**
 * 调用方错误原因码。被拒绝的操作不会改变任何状态，也不影响对手视图。
 */
public enum RejectReason {
    UNKNOWN_STYLE,
    ALREADY_LOCKED,
    WRONG_PHASE,
    ALREADY_SUBMITTED,
    SWING_CAP_REACHED,
    NO_SWINGS_TAKEN,
    ROUND_RESOLVED,
    ROUND_ABORTED,
    MATCH_NOT_FOUND,
    ROUND_NOT_FOUND,
    NOT_A_PARTICIPANT,
    INVALID_PAIRING;

    /** 资源不存在类（映射为 404） */
    public boolean notFound() {
        return this == MATCH_NOT_FOUND || this == ROUND_NOT_FOUND || this == NOT_A_PARTICIPANT;
    }

    /** 参数不合法类（映射为 400） */
    public boolean badInput() {
        return this == UNKNOWN_STYLE || this == INVALID_PAIRING;
    }
}
