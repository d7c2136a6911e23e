package com.duelhub.duelservice.games.duel.domain.rule;

import com.duelhub.duelservice.games.duel.domain.enums.Tier;

/**
 * 基础推条曲线（可调）：仅约定“档差越大推条越大”。
 */
@FunctionalInterface
public interface BasePushCurve {

    /**
     * @param winnerTier 胜者档位
     * @param loserTier  败者档位（佯攻破同档时与胜者相同）
     * @return 乘流派倍率之前的推条量（≥0）
     */
    double basePush(Tier winnerTier, Tier loserTier);
}
