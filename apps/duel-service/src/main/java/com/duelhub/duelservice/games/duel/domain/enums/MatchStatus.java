package com.duelhub.duelservice.games.duel.domain.enums;

public enum MatchStatus {

    FIGHTING,      // 进行中（逐回合结算）
    COMPLETE,      // 推条到底，已分胜负
    UNRESOLVABLE   // 某回合无法结算，等待外部处理
}
