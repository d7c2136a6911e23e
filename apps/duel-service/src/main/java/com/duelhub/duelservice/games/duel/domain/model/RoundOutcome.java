package com.duelhub.duelservice.games.duel.domain.model;

import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.enums.Tier;

/**
 * 回合结算结果，只写一次，之后任何读取都返回同一个对象。
 * 广播事件与同步响应都直接引用这个实例，不做二次推导。
 *
 * @param matchId      对局ID
 * @param roundNo      回合号（从 1 开始）
 * @param winnerId     胜者参与者ID；平局为 null
 * @param winnerSide   胜者席位；平局为 null
 * @param tierA        A 方锁定的最终档位
 * @param tierB        B 方锁定的最终档位
 * @param push         推条量（平局为 0）
 * @param tieBreakUsed 是否由佯攻打破同档
 * @param styleA       A 方流派（结算后公开）
 * @param styleB       B 方流派（结算后公开）
 * @param resolvedAt   结算时间（毫秒）
 */
public record RoundOutcome(String matchId,
                           int roundNo,
                           String winnerId,
                           Side winnerSide,
                           Tier tierA,
                           Tier tierB,
                           double push,
                           boolean tieBreakUsed,
                           String styleA,
                           String styleB,
                           long resolvedAt) {

    /** 是否平局 */
    public boolean draw() {
        return winnerSide == null;
    }

    public Tier tierOf(Side side) {
        return side == Side.A ? tierA : tierB;
    }
}
