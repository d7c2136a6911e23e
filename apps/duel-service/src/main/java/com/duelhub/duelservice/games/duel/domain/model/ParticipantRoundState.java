package com.duelhub.duelservice.games.duel.domain.model;

import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;
import lombok.Getter;

/**
 * 单个参与者在某一回合内的状态。
 * 只能在所属回合的锁内修改（由 {@link DuelRound} 负责）。
 */
@Getter
public class ParticipantRoundState {

    private final String participantId;

    /** 锁定的流派，写入后不再改变 */
    private StyleEffect style;
    /** 流派是否由超时默认分配 */
    private boolean styleDefaulted;

    /** 进入出手阶段时计算一次 */
    private EffectiveParams params;

    private int swingsUsed;
    /** 最近一次出手结果（后出手覆盖先出手） */
    private Tier currentRoll;
    /** 收手时锁定的结果，参与结算 */
    private Tier bestOutcome;

    private boolean submitted;
    /** 是否由出手阶段超时强制提交 */
    private boolean forcedSubmit;

    ParticipantRoundState(String participantId) {
        this.participantId = participantId;
    }

    public boolean styleLocked() {
        return style != null;
    }

    /** 剩余可出手次数；出手阶段之前为 0 */
    public int swingsRemaining() {
        return params == null ? 0 : Math.max(0, params.swingCap() - swingsUsed);
    }

    void lockStyle(StyleEffect effect, boolean defaulted) {
        this.style = effect;
        this.styleDefaulted = defaulted;
    }

    void assignParams(EffectiveParams params) {
        this.params = params;
    }

    void recordSwing(Tier outcome) {
        this.swingsUsed++;
        this.currentRoll = outcome;
    }

    void submit(boolean forced) {
        // 从未出手按最低档处理
        this.bestOutcome = currentRoll == null ? Tier.MISS : currentRoll;
        this.submitted = true;
        this.forcedSubmit = forced;
    }
}
