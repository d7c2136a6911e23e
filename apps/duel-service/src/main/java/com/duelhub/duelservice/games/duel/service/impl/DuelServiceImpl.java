package com.duelhub.duelservice.games.duel.service.impl;

import com.duelhub.duelservice.application.stats.CombatStatsDirectory;
import com.duelhub.duelservice.games.duel.application.RoundClockCoordinator;
import com.duelhub.duelservice.games.duel.application.RoundNotificationDispatcher;
import com.duelhub.duelservice.games.duel.domain.constants.DuelMessages;
import com.duelhub.duelservice.games.duel.domain.dto.LockStyleResult;
import com.duelhub.duelservice.games.duel.domain.dto.StopResult;
import com.duelhub.duelservice.games.duel.domain.dto.SwingResult;
import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.exception.DuelRejectedException;
import com.duelhub.duelservice.games.duel.domain.exception.RejectReason;
import com.duelhub.duelservice.games.duel.domain.exception.UnresolvableRoundException;
import com.duelhub.duelservice.games.duel.domain.model.DuelMatch;
import com.duelhub.duelservice.games.duel.domain.model.DuelRound;
import com.duelhub.duelservice.games.duel.domain.model.EffectiveParams;
import com.duelhub.duelservice.games.duel.domain.model.MatchView;
import com.duelhub.duelservice.games.duel.domain.model.ParticipantRoundState;
import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.duelhub.duelservice.games.duel.domain.model.RoundStateView;
import com.duelhub.duelservice.games.duel.domain.repository.RoundOutcomeRepository;
import com.duelhub.duelservice.games.duel.domain.rule.ModifierResolver;
import com.duelhub.duelservice.games.duel.domain.rule.RollGenerator;
import com.duelhub.duelservice.games.duel.domain.rule.RollSourceFactory;
import com.duelhub.duelservice.games.duel.domain.rule.RoundScorer;
import com.duelhub.duelservice.games.duel.domain.style.StyleCatalog;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;
import com.duelhub.duelservice.games.duel.service.DuelService;
import com.duelhub.duelservice.platform.config.DuelProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * DuelServiceImpl
 * -------------------------------------------------
 * 对局注册表 + 回合状态机编排。
 *
 * 串行化：每个回合一把公平锁，参与者动作与截止时间回调都在锁内执行，
 * 先排队的先处理；结算只会在锁内发生一次。
 * 已终结（RESOLVED/ABORTED）的回合不可变，读取不加锁。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuelServiceImpl implements DuelService {

    private final StyleCatalog catalog;
    private final ModifierResolver modifierResolver;
    private final RollGenerator rollGenerator;
    private final RoundScorer scorer;
    private final CombatStatsDirectory statsDirectory;
    private final RollSourceFactory rollSources;
    private final RoundClockCoordinator clockCoordinator;
    private final RoundNotificationDispatcher dispatcher;
    private final RoundOutcomeRepository archive;
    private final DuelProperties props;
    private final Clock clock;

    // 终局对局由 evictFinished 按保留期移除
    private final ConcurrentMap<String, DuelMatch> matches = new ConcurrentHashMap<>();

    // ---------------- 对局 ----------------

    @Override
    public MatchView createMatch(String challengerId, String opponentId) {
        if (StringUtils.isBlank(challengerId)) {
            throw new IllegalArgumentException("challengerId 不能为空");
        }
        if (StringUtils.isBlank(opponentId)) {
            throw new DuelRejectedException(RejectReason.INVALID_PAIRING, DuelMessages.OPPONENT_REQUIRED);
        }
        if (challengerId.equals(opponentId)) {
            throw new DuelRejectedException(RejectReason.INVALID_PAIRING, DuelMessages.CANNOT_DUEL_SELF);
        }
        String matchId = UUID.randomUUID().toString();
        DuelProperties.Bar bar = props.getBar();
        DuelMatch match = new DuelMatch(matchId, challengerId, opponentId, rollSources.create(matchId),
                bar.getStart(), bar.getMin(), bar.getMax(), clock.millis());
        matches.put(matchId, match);
        log.info("对局创建 match={} A={} B={}", matchId, challengerId, opponentId);
        openNextRound(match);
        return view(match);
    }

    @Override
    public MatchView getMatch(String matchId) {
        return view(requireMatch(matchId));
    }

    // ---------------- 回合动作 ----------------

    @Override
    public LockStyleResult lockStyle(String matchId, int roundNo, String participantId, String styleId) {
        DuelMatch match = requireMatch(matchId);
        Side side = requireSide(match, participantId);
        DuelRound round = requireRound(match, roundNo);
        round.lock();
        try {
            boolean both = round.lockStyle(side, styleId, catalog);
            ParticipantRoundState self = round.participant(side);
            log.debug("锁定流派 match={} round={} side={} style={}", matchId, roundNo, side, self.getStyle().getId());
            if (both) {
                enterSwing(match, round);
            }
            return new LockStyleResult(true, self.getStyle().getId(),
                    round.participant(side.other()).styleLocked(), round.phase());
        } finally {
            round.unlock();
        }
    }

    @Override
    public SwingResult swing(String matchId, int roundNo, String participantId) {
        DuelMatch match = requireMatch(matchId);
        Side side = requireSide(match, participantId);
        DuelRound round = requireRound(match, roundNo);
        round.lock();
        try {
            // 先校验再抽随机数，被拒绝的出手不消耗随机源
            round.checkCanSwing(side);
            ParticipantRoundState p = round.participant(side);
            Tier result;
            try {
                result = rollGenerator.swing(p.getParams(), match.rollSource());
            } catch (RuntimeException e) {
                throw abortRound(match, round, "随机源故障", e);
            }
            round.recordSwing(side, result);
            log.debug("出手 match={} round={} side={} result={} used={}", matchId, roundNo, side, result, p.getSwingsUsed());
            return new SwingResult(result, p.getSwingsUsed(), p.swingsRemaining(), p.getCurrentRoll());
        } finally {
            round.unlock();
        }
    }

    @Override
    public StopResult stop(String matchId, int roundNo, String participantId) {
        DuelMatch match = requireMatch(matchId);
        Side side = requireSide(match, participantId);
        DuelRound round = requireRound(match, roundNo);
        round.lock();
        try {
            Tier best = round.stop(side);
            log.debug("收手 match={} round={} side={} best={}", matchId, roundNo, side, best);
            RoundOutcome outcome = round.bothSubmitted() ? resolveLocked(match, round) : null;
            return new StopResult(best, outcome != null, outcome);
        } finally {
            round.unlock();
        }
    }

    @Override
    public RoundStateView getRoundState(String matchId, int roundNo, String viewerId) {
        DuelMatch match = requireMatch(matchId);
        DuelRound round = requireRound(match, roundNo);
        if (round.phase().terminal()) {
            return RoundStateView.of(round, viewerId);
        }
        round.lock();
        try {
            return RoundStateView.of(round, viewerId);
        } finally {
            round.unlock();
        }
    }

    @Override
    public Collection<StyleEffect> listStyles() {
        return catalog.all();
    }

    @Override
    public int evictFinished(long nowEpochMs) {
        long cutoff = nowEpochMs - props.getRetention().getFinished().toMillis();
        int evicted = 0;
        for (DuelMatch m : matches.values()) {
            if (m.endedBefore(cutoff) && matches.remove(m.matchId(), m)) {
                clockCoordinator.cancel(m.matchId());
                dispatcher.forget(m.matchId());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("移除已终局对局 {} 个，剩余 {}", evicted, matches.size());
        }
        return evicted;
    }

    // ---------------- 截止时间 ----------------

    @Override
    public void onDeadline(String matchId, int roundNo, RoundPhase phase) {
        DuelMatch match = matches.get(matchId);
        DuelRound round = match == null ? null : match.round(roundNo).orElse(null);
        if (round == null) {
            log.debug("截止回调找不到回合，忽略 match={} round={}", matchId, roundNo);
            return;
        }
        round.lock();
        try {
            if (round.phase() != phase) {
                log.debug("过期的截止回调，忽略 match={} round={} armed={} now={}", matchId, roundNo, phase, round.phase());
                return;
            }
            if (phase == RoundPhase.STYLE_SELECT) {
                round.applyDefaultStyles(catalog.defaultStyle());
                log.info("选流派超时，未锁定方使用默认流派 match={} round={}", matchId, roundNo);
                enterSwing(match, round);
            } else if (phase == RoundPhase.SWING) {
                round.forceSubmitPending();
                log.info("出手阶段超时，强制提交 match={} round={}", matchId, roundNo);
                resolveLocked(match, round);
            }
        } finally {
            round.unlock();
        }
    }

    // ---------------- 内部流程（除开新回合外均在回合锁内调用） ----------------

    private void openNextRound(DuelMatch match) {
        long deadline = clock.millis() + props.getStyle().getSeconds() * 1000L;
        DuelRound round = match.openRound(deadline);
        clockCoordinator.armStyleDeadline(round, this::onDeadline);
        log.info("回合开始 match={} round={} 选流派截止={}", match.matchId(), round.roundNo(), deadline);
    }

    /**
     * 进入出手阶段：有效参数在这里算一次，本回合复用。
     */
    private void enterSwing(DuelMatch match, DuelRound round) {
        StyleEffect styleA = round.participant(Side.A).getStyle();
        StyleEffect styleB = round.participant(Side.B).getStyle();
        Map<Side, EffectiveParams> params = modifierResolver.resolve(styleA, styleB,
                statsDirectory.statsOf(match.participantId(Side.A)),
                statsDirectory.statsOf(match.participantId(Side.B)));
        long deadline = clock.millis() + props.getSwing().getSeconds() * 1000L;
        round.enterSwingPhase(params, deadline);
        clockCoordinator.armSwingDeadline(round, this::onDeadline);
        log.info("进入出手阶段 match={} round={} A={} B={}", match.matchId(), round.roundNo(), styleA.getId(), styleB.getId());
        dispatcher.swingStarted(match, round);
    }

    /**
     * 结算：写入结果 → 归档 → 推条 → 广播 → 开下一回合或终局。
     */
    private RoundOutcome resolveLocked(DuelMatch match, DuelRound round) {
        RoundOutcome outcome;
        try {
            outcome = scorer.score(round, clock.millis());
            round.resolve(outcome);
        } catch (RuntimeException e) {
            throw abortRound(match, round, "结算失败: " + e.getMessage(), e);
        }
        clockCoordinator.cancel(match.matchId());
        log.info("回合结算 match={} round={} winner={} A={} B={} push={} tieBreak={}", match.matchId(), round.roundNo(),
                outcome.winnerSide(), outcome.tierA(), outcome.tierB(), outcome.push(), outcome.tieBreakUsed());

        archiveOutcome(outcome);
        Optional<Side> matchWinner = match.applyOutcome(outcome);
        dispatcher.roundResolved(match, outcome);
        if (matchWinner.isPresent()) {
            log.info("对局结束 match={} winner={} bar={}", match.matchId(), match.winnerId(), match.bar());
            dispatcher.matchEnded(match);
        } else {
            openNextRound(match);
        }
        return outcome;
    }

    private void archiveOutcome(RoundOutcome outcome) {
        try {
            archive.save(outcome);
        } catch (RuntimeException e) {
            log.warn("回合结果归档失败 match={} round={}: {}", outcome.matchId(), outcome.roundNo(), e.getMessage());
        }
    }

    /**
     * 致命错误：中止回合、对局标记为无法结算、停掉计时，不广播任何结果。
     */
    private UnresolvableRoundException abortRound(DuelMatch match, DuelRound round, String reason, Throwable cause) {
        round.abort(reason);
        match.markUnresolvable(DuelMessages.formatRoundUnresolvable(round.roundNo()), clock.millis());
        clockCoordinator.cancel(match.matchId());
        log.error("回合中止 match={} round={} reason={}", match.matchId(), round.roundNo(), reason);
        return new UnresolvableRoundException(match.matchId(), round.roundNo(), reason, cause);
    }

    // ---------------- 查找 ----------------

    private DuelMatch requireMatch(String matchId) {
        DuelMatch m = matchId == null ? null : matches.get(matchId);
        if (m == null) {
            throw new DuelRejectedException(RejectReason.MATCH_NOT_FOUND, DuelMessages.formatMatchNotFound(matchId));
        }
        return m;
    }

    private static Side requireSide(DuelMatch match, String participantId) {
        return match.sideOf(participantId).orElseThrow(() ->
                new DuelRejectedException(RejectReason.NOT_A_PARTICIPANT, DuelMessages.NOT_A_PARTICIPANT));
    }

    private static DuelRound requireRound(DuelMatch match, int roundNo) {
        return match.round(roundNo).orElseThrow(() ->
                new DuelRejectedException(RejectReason.ROUND_NOT_FOUND, DuelMessages.formatRoundNotFound(roundNo)));
    }

    private MatchView view(DuelMatch match) {
        return MatchView.of(match, props.getBar().getMin(), props.getBar().getMax());
    }
}
