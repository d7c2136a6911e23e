package com.duelhub.duelservice.games.duel.domain.model;

import com.duelhub.duelservice.games.duel.domain.enums.MatchStatus;
import com.duelhub.duelservice.games.duel.domain.enums.Side;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 对局：两名参与者 + 按回合号索引的回合序列 + 拔河条。
 * <p>
 * 推条规则：A 方获胜把条推向 barMin，B 方获胜推向 barMax；到达任一端即终局。
 * 回合只会在上一回合结算后追加（在上一回合的锁内），因此同一对局不会有两个回合同时处于活动状态。
 */
public class DuelMatch {

    private final String matchId;
    private final Map<Side, String> participants = new EnumMap<>(Side.class);
    private final List<DuelRound> rounds = new CopyOnWriteArrayList<>();
    private final RollSource rollSource;
    private final long createdAt;

    private final double barMin;
    private final double barMax;
    private double bar;

    private volatile MatchStatus status = MatchStatus.FIGHTING;
    private volatile String winnerId;
    private volatile String faultReason;
    /** 终局（完成或无法结算）时间，进行中为 0 */
    private volatile long endedAt;

    public DuelMatch(String matchId, String challengerId, String opponentId, RollSource rollSource,
                     double barStart, double barMin, double barMax, long createdAt) {
        this.matchId = Objects.requireNonNull(matchId, "matchId");
        this.participants.put(Side.A, Objects.requireNonNull(challengerId, "challengerId"));
        this.participants.put(Side.B, Objects.requireNonNull(opponentId, "opponentId"));
        this.rollSource = Objects.requireNonNull(rollSource, "rollSource");
        this.barMin = barMin;
        this.barMax = barMax;
        this.bar = barStart;
        this.createdAt = createdAt;
    }

    /**
     * 开启下一回合（回合号连续递增，从 1 开始）。
     */
    public DuelRound openRound(long styleDeadlineEpochMs) {
        if (status != MatchStatus.FIGHTING) {
            throw new IllegalStateException("对局已结束，不能开启新回合: " + status);
        }
        int next = rounds.size() + 1;
        DuelRound r = new DuelRound(matchId, next, participants.get(Side.A), participants.get(Side.B),
                styleDeadlineEpochMs);
        rounds.add(r);
        return r;
    }

    /**
     * 把结算结果作用到拔河条。
     * @return 若终局，返回获胜席位
     */
    public synchronized Optional<Side> applyOutcome(RoundOutcome outcome) {
        if (status != MatchStatus.FIGHTING || outcome.draw() || outcome.push() <= 0) {
            return Optional.empty();
        }
        if (outcome.winnerSide() == Side.A) {
            bar = Math.max(barMin, bar - outcome.push());
        } else {
            bar = Math.min(barMax, bar + outcome.push());
        }
        if (bar <= barMin) {
            return Optional.of(complete(Side.A, outcome.resolvedAt()));
        }
        if (bar >= barMax) {
            return Optional.of(complete(Side.B, outcome.resolvedAt()));
        }
        return Optional.empty();
    }

    private Side complete(Side side, long at) {
        this.winnerId = participants.get(side);
        this.endedAt = at;
        this.status = MatchStatus.COMPLETE;
        return side;
    }

    /** 标记为无法结算（等待外部处理） */
    public void markUnresolvable(String reason, long at) {
        this.faultReason = reason;
        this.endedAt = at;
        this.status = MatchStatus.UNRESOLVABLE;
    }

    // ---------------- 读 ----------------

    public String matchId() { return matchId; }
    public RollSource rollSource() { return rollSource; }
    public long createdAt() { return createdAt; }
    public MatchStatus status() { return status; }
    public String winnerId() { return winnerId; }
    public String faultReason() { return faultReason; }
    public long endedAt() { return endedAt; }

    /** 已终局且终局时间早于 cutoff */
    public boolean endedBefore(long cutoffEpochMs) {
        return status != MatchStatus.FIGHTING && endedAt < cutoffEpochMs;
    }

    public synchronized double bar() {
        return bar;
    }

    public String participantId(Side side) {
        return participants.get(side);
    }

    public Map<Side, String> participants() {
        return Collections.unmodifiableMap(participants);
    }

    public Optional<Side> sideOf(String participantId) {
        if (participantId == null) return Optional.empty();
        return participants.entrySet().stream()
                .filter(e -> e.getValue().equals(participantId))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Optional<DuelRound> round(int roundNo) {
        if (roundNo < 1 || roundNo > rounds.size()) return Optional.empty();
        return Optional.of(rounds.get(roundNo - 1));
    }

    public DuelRound currentRound() {
        return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
    }

    public int roundCount() {
        return rounds.size();
    }
}
