package com.duelhub.duelservice.games.duel.domain.rule;

import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.model.DuelRound;
import com.duelhub.duelservice.games.duel.domain.model.ParticipantRoundState;
import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;

/**
 * 回合裁决：
 * 1) 档位高者直接胜出；
 * 2) 同档时看佯攻：恰好一方为佯攻则该方胜，双方都是或都不是则平局（不推条）；
 * 3) 推条 = 基础推条 × 胜者 winPushMult × 败者 loseOpponentPushMult（两个倍率依次相乘，互不抵消）。
 */
public class RoundScorer {

    private final BasePushCurve pushCurve;

    public RoundScorer(BasePushCurve pushCurve) {
        this.pushCurve = pushCurve;
    }

    /**
     * 计算结算结果（不修改回合，由调用方写入）。
     */
    public RoundOutcome score(DuelRound round, long resolvedAt) {
        ParticipantRoundState a = round.participant(Side.A);
        ParticipantRoundState b = round.participant(Side.B);
        Tier tierA = bestOf(a);
        Tier tierB = bestOf(b);

        Side winner = null;
        boolean tieBreakUsed = false;
        if (tierA.beats(tierB)) {
            winner = Side.A;
        } else if (tierB.beats(tierA)) {
            winner = Side.B;
        } else {
            boolean feintA = a.getStyle().isFeintTiebreak();
            boolean feintB = b.getStyle().isFeintTiebreak();
            if (feintA != feintB) {
                winner = feintA ? Side.A : Side.B;
                tieBreakUsed = true;
            }
        }

        double push = 0.0;
        String winnerId = null;
        if (winner != null) {
            ParticipantRoundState w = winner == Side.A ? a : b;
            ParticipantRoundState l = winner == Side.A ? b : a;
            winnerId = w.getParticipantId();
            push = finalPush(bestOf(w), bestOf(l), w.getStyle(), l.getStyle());
        }

        return new RoundOutcome(round.matchId(), round.roundNo(), winnerId, winner,
                tierA, tierB, push, tieBreakUsed,
                a.getStyle().getId(), b.getStyle().getId(), resolvedAt);
    }

    double finalPush(Tier winnerTier, Tier loserTier, StyleEffect winnerStyle, StyleEffect loserStyle) {
        double base = pushCurve.basePush(winnerTier, loserTier);
        return base * winnerStyle.getWinPushMult() * loserStyle.getLoseOpponentPushMult();
    }

    private static Tier bestOf(ParticipantRoundState p) {
        return p.getBestOutcome() == null ? Tier.MISS : p.getBestOutcome();
    }
}
