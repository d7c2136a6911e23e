package com.duelhub.duelservice.games.duel.domain.enums;

/**
 * 回合阶段，只能单向推进：STYLE_SELECT → SWING → RESOLVED。
 * ABORTED 为异常终态（随机源故障/内部不变量被破坏），不产生结算事件。
 */
public enum RoundPhase {

    STYLE_SELECT, // 选流派（10s 计时）
    SWING,        // 出手阶段（各自出手/收手）
    RESOLVED,     // 已结算（不可变）
    ABORTED;      // 无法结算（交由对局外部处理）

    /** 是否为终态 */
    public boolean terminal() {
        return this == RESOLVED || this == ABORTED;
    }
}
