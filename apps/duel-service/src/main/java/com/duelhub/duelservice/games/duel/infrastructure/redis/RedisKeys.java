package com.duelhub.duelservice.games.duel.infrastructure.redis;

/**
 * 对决相关 Redis Key 统一在这里拼接。
 */
public final class RedisKeys {

    private static final String PFX = "duel:";

    private RedisKeys() {}

    // ---- 回合结算归档 ----
    public static String outcome(String matchId, int roundNo) {
        return PFX + "outcome:" + matchId + ":" + roundNo;
    }
}
