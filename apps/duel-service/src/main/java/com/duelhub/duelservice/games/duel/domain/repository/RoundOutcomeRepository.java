package com.duelhub.duelservice.games.duel.domain.repository;

import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;

import java.util.Optional;

/**
 * 已结算回合的归档仓储。
 * 每个结算回合调用一次 save；写入失败不影响回合结果与通知。
 */
public interface RoundOutcomeRepository {

    void save(RoundOutcome outcome);

    Optional<RoundOutcome> find(String matchId, int roundNo);
}
