package com.duelhub.duelservice.games.duel.domain.rule;

import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.model.EffectiveParams;
import com.duelhub.duelservice.games.duel.domain.model.RollSource;

/**
 * 单次出手判定：取一个 [0,1) 均匀数，
 * 落在暴击区间 [0, crit) → CRITICAL；落在命中区间 [crit, crit + max(0, hit - crit)) → HIT；否则 MISS。
 */
public class RollGenerator {

    /**
     * 每次出手调用且只调用一次。
     * @throws IllegalStateException 随机源返回区间外的值（视为随机源故障）
     */
    public Tier swing(EffectiveParams params, RollSource source) {
        double r = source.nextDouble();
        if (Double.isNaN(r) || r < 0.0 || r >= 1.0) {
            throw new IllegalStateException("随机源返回越界值: " + r);
        }
        if (r < params.critBand()) {
            return Tier.CRITICAL;
        }
        if (r < params.critBand() + params.hitBand()) {
            return Tier.HIT;
        }
        return Tier.MISS;
    }
}
