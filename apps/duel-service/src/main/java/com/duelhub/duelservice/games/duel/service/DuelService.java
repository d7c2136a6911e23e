package com.duelhub.duelservice.games.duel.service;

import com.duelhub.duelservice.games.duel.domain.dto.LockStyleResult;
import com.duelhub.duelservice.games.duel.domain.dto.StopResult;
import com.duelhub.duelservice.games.duel.domain.dto.SwingResult;
import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.model.MatchView;
import com.duelhub.duelservice.games.duel.domain.model.RoundStateView;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;

import java.util.Collection;

/**
 * 对决服务：对局生命周期 + 回合动作。
 * <p>
 * 所有修改动作按回合串行；被拒绝的动作抛 {@link com.duelhub.duelservice.games.duel.domain.exception.DuelRejectedException}，
 * 不改变任何状态。
 */
public interface DuelService {

    /**
     * 创建对局，第 1 回合进入选流派阶段。
     * @param challengerId 发起方（A 方）
     * @param opponentId   应战方（B 方）
     */
    MatchView createMatch(String challengerId, String opponentId);

    /** 对局概要（无副作用） */
    MatchView getMatch(String matchId);

    LockStyleResult lockStyle(String matchId, int roundNo, String participantId, String styleId);

    SwingResult swing(String matchId, int roundNo, String participantId);

    /**
     * 收手；若双方都已提交则在本次调用内完成结算。
     */
    StopResult stop(String matchId, int roundNo, String participantId);

    /**
     * 回合状态（幂等，无副作用）。
     * @param viewerId 观察者，可空；为参与者时附带其私有字段
     */
    RoundStateView getRoundState(String matchId, int roundNo, String viewerId);

    /** 流派目录 */
    Collection<StyleEffect> listStyles();

    /**
     * 截止时间到期（由计时器调用）。阶段已变化的过期回调直接忽略。
     */
    void onDeadline(String matchId, int roundNo, RoundPhase phase);

    /**
     * 移除终局时间早于保留期的对局（完成或无法结算），同时清理其投递台账。
     * @return 移除的对局数
     */
    int evictFinished(long nowEpochMs);
}
