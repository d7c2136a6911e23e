package com.duelhub.duelservice.application.stats;

import com.duelhub.duelservice.games.duel.domain.model.BaseCombatStats;

/**
 * 参与者基础战斗属性查询（外部协作方）。
 */
public interface CombatStatsDirectory {

    /**
     * @param participantId 参与者ID
     * @return 基础命中/暴击/出手上限，不为 null
     */
    BaseCombatStats statsOf(String participantId);
}
