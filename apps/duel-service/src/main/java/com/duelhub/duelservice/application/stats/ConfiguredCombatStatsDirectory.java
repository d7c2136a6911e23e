package com.duelhub.duelservice.application.stats;

import com.duelhub.duelservice.games.duel.domain.model.BaseCombatStats;
import com.duelhub.duelservice.platform.config.DuelProperties;
import lombok.RequiredArgsConstructor;

/**
 * 基于配置的基础属性来源：默认值 + 按参与者覆盖。
 */
@RequiredArgsConstructor
public class ConfiguredCombatStatsDirectory implements CombatStatsDirectory {

    private final DuelProperties props;

    @Override
    public BaseCombatStats statsOf(String participantId) {
        DuelProperties.Stats stats = props.getStats();
        double hit = stats.getBaseHitChance();
        double crit = stats.getBaseCritRate();
        int cap = props.getSwing().getBaseCap();

        DuelProperties.StatsOverride o = participantId == null ? null : stats.getOverrides().get(participantId);
        if (o != null) {
            if (o.getBaseHitChance() != null) hit = o.getBaseHitChance();
            if (o.getBaseCritRate() != null) crit = o.getBaseCritRate();
            if (o.getBaseRollCap() != null) cap = o.getBaseRollCap();
        }
        return new BaseCombatStats(hit, crit, cap);
    }
}
