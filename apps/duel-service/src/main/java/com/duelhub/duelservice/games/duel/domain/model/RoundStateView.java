package com.duelhub.duelservice.games.duel.domain.model;

import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * 回合视图（按观察者裁剪）。
 * <ul>
 *   <li>公开：阶段、截止时间、双方是否锁定/出手次数/是否提交；</li>
 *   <li>对手流派：双方都锁定或已离开选流派阶段后才可见；</li>
 *   <li>当前结果与赔率：仅本人可见，结算后全部公开。</li>
 * </ul>
 * 必须在回合锁内或回合已终结时构建。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoundStateView {
    private String matchId;
    private int roundNo;
    private RoundPhase phase;
    private long styleDeadlineEpochMs;
    private Long swingDeadlineEpochMs;
    private Map<Side, ParticipantView> participants;
    /** 结算后为同一个结果对象 */
    private RoundOutcome outcome;
    private String abortReason;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ParticipantView {
        private String participantId;
        private boolean styleLocked;
        private String style;
        private Boolean styleDefaulted;
        private int swingsUsed;
        private Integer swingCap;
        private boolean submitted;
        private boolean forcedSubmit;
        private Tier currentRoll;
        private Tier bestOutcome;
        private Odds odds;
    }

    /** 展示赔率，和判定用的是同一组有效参数 */
    public record Odds(double hitChance, double critChance, double missChance) {
        static Odds of(EffectiveParams p) {
            return new Odds(p.hitBand(), p.critBand(), p.missChance());
        }
    }

    /**
     * @param viewerId 观察者参与者ID；null 或非参与者只看公开字段
     */
    public static RoundStateView of(DuelRound round, String viewerId) {
        RoundStateView v = new RoundStateView();
        v.setMatchId(round.matchId());
        v.setRoundNo(round.roundNo());
        RoundPhase phase = round.phase();
        v.setPhase(phase);
        v.setStyleDeadlineEpochMs(round.styleDeadlineEpochMs());
        if (round.swingDeadlineEpochMs() > 0) {
            v.setSwingDeadlineEpochMs(round.swingDeadlineEpochMs());
        }
        boolean resolved = phase == RoundPhase.RESOLVED;
        boolean stylesPublic = round.bothStylesLocked() || phase != RoundPhase.STYLE_SELECT;

        Map<Side, ParticipantView> seats = new EnumMap<>(Side.class);
        round.participants().forEach((side, p) -> {
            boolean self = p.getParticipantId().equals(viewerId);
            ParticipantView pv = new ParticipantView();
            pv.setParticipantId(p.getParticipantId());
            pv.setStyleLocked(p.styleLocked());
            if (p.styleLocked() && (self || stylesPublic)) {
                pv.setStyle(p.getStyle().getId());
                pv.setStyleDefaulted(p.isStyleDefaulted());
            }
            pv.setSwingsUsed(p.getSwingsUsed());
            if (p.getParams() != null) {
                pv.setSwingCap(p.getParams().swingCap());
                if (self) {
                    pv.setOdds(Odds.of(p.getParams()));
                }
            }
            pv.setSubmitted(p.isSubmitted());
            pv.setForcedSubmit(p.isForcedSubmit());
            if (self || resolved) {
                pv.setCurrentRoll(p.getCurrentRoll());
                pv.setBestOutcome(p.getBestOutcome());
            }
            seats.put(side, pv);
        });
        v.setParticipants(seats);
        v.setOutcome(round.outcome());
        v.setAbortReason(round.abortReason());
        return v;
    }
}
