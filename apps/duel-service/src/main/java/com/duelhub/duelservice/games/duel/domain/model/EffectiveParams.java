package com.duelhub.duelservice.games.duel.domain.model;

/**
 * 某参与者在本回合的有效出手参数（流派叠加后，概率已夹到 [0,1]）。
 *
 * @param hitChance 有效命中率（含暴击）
 * @param critRate  有效暴击率
 * @param swingCap  有效出手上限（≥1）
 */
public record EffectiveParams(double hitChance, double critRate, int swingCap) {

    /** 暴击区间大小 */
    public double critBand() {
        return critRate;
    }

    /** 普通命中区间大小：命中率减暴击率，下限 0 */
    public double hitBand() {
        return Math.max(0.0, hitChance - critRate);
    }

    /** 未命中概率（展示用） */
    public double missChance() {
        return Math.max(0.0, 1.0 - critBand() - hitBand());
    }
}
