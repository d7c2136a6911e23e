package com.duelhub.duelservice.games.duel.domain.model;

import com.duelhub.duelservice.games.duel.domain.enums.MatchStatus;
import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.enums.Side;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * 对局概要视图（只读，无副作用）。
 */
@Data
public class MatchView {
    private String matchId;
    private MatchStatus status;
    private double bar;
    private double barMin;
    private double barMax;
    private int currentRound;
    private RoundPhase currentPhase;
    private Map<Side, String> participants;
    private String winnerId;
    private String faultReason;
    private long createdAt;

    public static MatchView of(DuelMatch m, double barMin, double barMax) {
        MatchView v = new MatchView();
        v.setMatchId(m.matchId());
        v.setStatus(m.status());
        v.setBar(m.bar());
        v.setBarMin(barMin);
        v.setBarMax(barMax);
        DuelRound cur = m.currentRound();
        if (cur != null) {
            v.setCurrentRound(cur.roundNo());
            v.setCurrentPhase(cur.phase());
        }
        v.setParticipants(new EnumMap<>(m.participants()));
        v.setWinnerId(m.winnerId());
        v.setFaultReason(m.faultReason());
        v.setCreatedAt(m.createdAt());
        return v;
    }
}
