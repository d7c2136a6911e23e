package com.duelhub.duelservice.games.duel.infrastructure.redis.repo;

import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.duelhub.duelservice.games.duel.domain.repository.RoundOutcomeRepository;
import com.duelhub.duelservice.games.duel.infrastructure.redis.RedisKeys;
import com.duelhub.duelservice.infrastructure.redis.RedisOps;
import com.duelhub.duelservice.platform.config.DuelProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * RedisRoundOutcomeRepository
 * -------------------------------------------------------
 * 回合结果归档（duel.archive.store=redis）。
 * 每回合一个 JSON 值，键 duel:outcome:{matchId}:{roundNo}，带 TTL。
 * 结果只写一次，使用 SETNX 保证不会被覆盖。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "duel.archive", name = "store", havingValue = "redis")
public class RedisRoundOutcomeRepository implements RoundOutcomeRepository {

    private final RedisOps ops;
    private final DuelProperties props;

    @Override
    public void save(RoundOutcome outcome) {
        ops.setNx(RedisKeys.outcome(outcome.matchId(), outcome.roundNo()), outcome, props.getArchive().getTtl());
    }

    @Override
    public Optional<RoundOutcome> find(String matchId, int roundNo) {
        return Optional.ofNullable(ops.get(RedisKeys.outcome(matchId, roundNo), RoundOutcome.class));
    }
}
