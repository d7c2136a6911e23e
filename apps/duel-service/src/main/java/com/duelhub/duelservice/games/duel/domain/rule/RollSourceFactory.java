package com.duelhub.duelservice.games.duel.domain.rule;

import com.duelhub.duelservice.games.duel.domain.model.RollSource;

/**
 * 每个对局一个独立随机源。
 */
@FunctionalInterface
public interface RollSourceFactory {

    RollSource create(String matchId);
}
