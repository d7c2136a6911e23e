package com.duelhub.duelservice.games.duel.domain.enums;

/**
 * 对决双方的席位。
 * A = 发起方（推条方向：向 bar.min），B = 应战方（推条方向：向 bar.max）。
 */
public enum Side {
    A,
    B;

    public Side other() {
        return this == A ? B : A;
    }
}
