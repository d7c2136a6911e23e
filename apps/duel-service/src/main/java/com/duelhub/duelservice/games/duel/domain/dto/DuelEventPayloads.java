package com.duelhub.duelservice.games.duel.domain.dto;

/**
 * 广播事件载荷。
 */
public final class DuelEventPayloads {

    private DuelEventPayloads() {
    }

    /** 进入出手阶段：双方流派此时公开 */
    public record SwingStarted(int roundNo, String styleA, String styleB, long swingDeadlineEpochMs) {
    }

    /** 对局结束 */
    public record MatchEnded(String matchId, String winnerId, double finalBar, int rounds) {
    }

    /** 每秒倒计时 */
    public record Tick(int roundNo, String phase, long deadlineEpochMs, long left) {
    }
}
