package com.duelhub.duelservice.games.duel.domain.model;

/**
 * 参与者基础战斗属性（由外部属性服务提供，本引擎视为不透明输入）。
 *
 * @param baseHitChance 基础命中率 [0,1]
 * @param baseCritRate  基础暴击率 [0,1]
 * @param baseRollCap   基础出手上限（≥1）
 */
public record BaseCombatStats(double baseHitChance, double baseCritRate, int baseRollCap) {
}
