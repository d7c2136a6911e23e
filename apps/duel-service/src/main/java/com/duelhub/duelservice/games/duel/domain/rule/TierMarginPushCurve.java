package com.duelhub.duelservice.games.duel.domain.rule;

import com.duelhub.duelservice.games.duel.domain.enums.Tier;

/**
 * 默认推条曲线：
 * <pre>
 *   tierPush(MISS) = 0, tierPush(HIT) = base, tierPush(CRITICAL) = base × criticalBonus
 *   档差 m ≥ 1：tierPush(胜者) × (1 + marginBonus × (m - 1))
 *   档差 m = 0（佯攻破同档）：tierPush(胜者)
 * </pre>
 */
public class TierMarginPushCurve implements BasePushCurve {

    private final double base;
    private final double criticalBonus;
    private final double marginBonus;

    public TierMarginPushCurve(double base, double criticalBonus, double marginBonus) {
        if (base < 0 || criticalBonus < 0 || marginBonus < 0) {
            throw new IllegalArgumentException("推条参数不能为负");
        }
        this.base = base;
        this.criticalBonus = criticalBonus;
        this.marginBonus = marginBonus;
    }

    @Override
    public double basePush(Tier winnerTier, Tier loserTier) {
        double tierPush = switch (winnerTier) {
            case MISS -> 0.0;
            case HIT -> base;
            case CRITICAL -> base * criticalBonus;
        };
        int margin = winnerTier.marginOver(loserTier);
        if (margin <= 1) {
            return tierPush;
        }
        return tierPush * (1 + marginBonus * (margin - 1));
    }
}
