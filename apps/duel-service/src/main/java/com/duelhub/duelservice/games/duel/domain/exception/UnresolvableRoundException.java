package com.duelhub.duelservice.games.duel.domain.exception;

import lombok.Getter;

/**
 * 致命错误：随机源故障或内部不变量被破坏。
 * 回合被中止（ABORTED），对局标记为 UNRESOLVABLE，不广播任何结算结果。
 */
@Getter
public class UnresolvableRoundException extends RuntimeException {

    private final String matchId;
    private final int roundNo;

    public UnresolvableRoundException(String matchId, int roundNo, String message, Throwable cause) {
        super("ROUND_UNRESOLVABLE: match=" + matchId + " round=" + roundNo + " " + message, cause);
        this.matchId = matchId;
        this.roundNo = roundNo;
    }
}
