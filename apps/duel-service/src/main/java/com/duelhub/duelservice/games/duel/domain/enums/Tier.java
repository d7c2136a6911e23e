package com.duelhub.duelservice.games.duel.domain.enums;

/** 出手结果档位：未命中 < 命中 < 暴击（rank 用于比较与计算档差） */
public enum Tier {
    /** 未命中 */
    MISS(0),
    /** 命中 */
    HIT(1),
    /** 暴击 */
    CRITICAL(2);

    private final int rank;

    Tier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** 是否严格高于另一档 */
    public boolean beats(Tier other) {
        return rank > other.rank;
    }

    /**
     * 两档之间的档差（非负）。
     * @param lower 较低一方的档位
     */
    public int marginOver(Tier lower) {
        return Math.max(0, rank - lower.rank);
    }
}
