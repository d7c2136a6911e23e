package com.duelhub.duelservice.games.duel.infrastructure.memory;

import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.duelhub.duelservice.games.duel.domain.repository.RoundOutcomeRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内归档（默认）。
 */
@Repository
@ConditionalOnProperty(prefix = "duel.archive", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRoundOutcomeRepository implements RoundOutcomeRepository {

    private final ConcurrentMap<String, RoundOutcome> store = new ConcurrentHashMap<>();

    @Override
    public void save(RoundOutcome outcome) {
        store.putIfAbsent(key(outcome.matchId(), outcome.roundNo()), outcome);
    }

    @Override
    public Optional<RoundOutcome> find(String matchId, int roundNo) {
        return Optional.ofNullable(store.get(key(matchId, roundNo)));
    }

    private static String key(String matchId, int roundNo) {
        return matchId + ":" + roundNo;
    }
}
