package com.duelhub.duelservice.games.duel.domain.rule;

import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.model.BaseCombatStats;
import com.duelhub.duelservice.games.duel.domain.model.EffectiveParams;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;

import java.util.EnumMap;
import java.util.Map;

/**
 * 流派修正解析（纯函数）。
 * <ul>
 *   <li>有效命中 = 基础命中 × 自身命中倍率 × 对手施加的命中倍率</li>
 *   <li>有效暴击 = 基础暴击 × 自身暴击倍率</li>
 *   <li>出手上限 = max(1, 基础上限 + 自身增减)</li>
 * </ul>
 * 倍率一律相乘，不做加法；概率最后夹到 [0,1]。
 */
public class ModifierResolver {

    public Map<Side, EffectiveParams> resolve(StyleEffect styleA, StyleEffect styleB,
                                              BaseCombatStats statsA, BaseCombatStats statsB) {
        Map<Side, EffectiveParams> out = new EnumMap<>(Side.class);
        out.put(Side.A, effective(styleA, styleB, statsA));
        out.put(Side.B, effective(styleB, styleA, statsB));
        return out;
    }

    /**
     * 计算单方有效参数。
     * @param self     自身流派
     * @param opponent 对手流派（只取其 opponentHitMult）
     * @param stats    自身基础属性
     */
    public EffectiveParams effective(StyleEffect self, StyleEffect opponent, BaseCombatStats stats) {
        double hit = clamp01(stats.baseHitChance() * self.getSelfHitMult() * opponent.getOpponentHitMult());
        double crit = clamp01(stats.baseCritRate() * self.getSelfCritMult());
        int cap = Math.max(1, stats.baseRollCap() + self.getSelfRollCapDelta());
        return new EffectiveParams(hit, crit, cap);
    }

    static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
