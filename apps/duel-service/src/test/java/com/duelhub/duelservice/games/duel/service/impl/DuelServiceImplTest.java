package com.duelhub.duelservice.games.duel.service.impl;

import com.duelhub.duelservice.application.stats.ConfiguredCombatStatsDirectory;
import com.duelhub.duelservice.clock.scheduler.CountdownScheduler;
import com.duelhub.duelservice.clock.scheduler.CountdownSchedulerImpl;
import com.duelhub.duelservice.games.duel.application.RoundClockCoordinator;
import com.duelhub.duelservice.games.duel.application.RoundNotificationDispatcher;
import com.duelhub.duelservice.games.duel.domain.constants.DuelMessages;
import com.duelhub.duelservice.games.duel.domain.dto.LockStyleResult;
import com.duelhub.duelservice.games.duel.domain.dto.StopResult;
import com.duelhub.duelservice.games.duel.domain.dto.SwingResult;
import com.duelhub.duelservice.games.duel.domain.enums.MatchStatus;
import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.exception.DuelRejectedException;
import com.duelhub.duelservice.games.duel.domain.exception.RejectReason;
import com.duelhub.duelservice.games.duel.domain.exception.UnresolvableRoundException;
import com.duelhub.duelservice.games.duel.domain.model.DuelMatch;
import com.duelhub.duelservice.games.duel.domain.model.MatchView;
import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.duelhub.duelservice.games.duel.domain.model.RoundStateView;
import com.duelhub.duelservice.games.duel.domain.repository.RoundOutcomeRepository;
import com.duelhub.duelservice.games.duel.domain.rule.ModifierResolver;
import com.duelhub.duelservice.games.duel.domain.rule.RollGenerator;
import com.duelhub.duelservice.games.duel.domain.rule.RoundScorer;
import com.duelhub.duelservice.games.duel.domain.rule.TierMarginPushCurve;
import com.duelhub.duelservice.games.duel.domain.style.StyleCatalog;
import com.duelhub.duelservice.games.duel.infrastructure.memory.InMemoryRoundOutcomeRepository;
import com.duelhub.duelservice.platform.config.DuelProperties;
import com.duelhub.duelservice.support.ManualCountdownScheduler;
import com.duelhub.duelservice.support.RecordingEventPublisher;
import com.duelhub.duelservice.support.ScriptedRollSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class DuelServiceImplTest {

    // 默认属性：命中 0.65、暴击 0.10 → r<0.10 暴击，r<0.65 命中，其余未命中
    private static final double CRIT = 0.05;
    private static final double HIT = 0.30;
    private static final double MISS = 0.90;

    private static final String A = "alice";
    private static final String B = "bob";

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private DuelProperties props;
    private ManualCountdownScheduler scheduler;
    private RecordingEventPublisher publisher;
    private ScriptedRollSource rolls;
    private RoundOutcomeRepository archive;
    private RoundNotificationDispatcher dispatcher;
    private DuelServiceImpl service;

    @BeforeEach
    void setUp() {
        props = new DuelProperties();
        scheduler = new ManualCountdownScheduler();
        publisher = new RecordingEventPublisher();
        rolls = new ScriptedRollSource();
        archive = new InMemoryRoundOutcomeRepository();
        dispatcher = spy(new RoundNotificationDispatcher(publisher));
        service = newService(archive);
    }

    private DuelServiceImpl newService(RoundOutcomeRepository repo) {
        return newService(repo, scheduler);
    }

    private DuelServiceImpl newService(RoundOutcomeRepository repo, CountdownScheduler countdowns) {
        return new DuelServiceImpl(StyleCatalog.canonical(), new ModifierResolver(), new RollGenerator(),
                new RoundScorer(new TierMarginPushCurve(10.0, 1.5, 0.5)),
                new ConfiguredCombatStatsDirectory(props), matchId -> rolls,
                new RoundClockCoordinator(countdowns, publisher), dispatcher,
                repo, props, clock);
    }

    /** 双方各出手一次后收手，A 命中 B 未命中 */
    private void playRoundWonByA(String matchId, int roundNo) {
        service.lockStyle(matchId, roundNo, A, "balanced");
        service.lockStyle(matchId, roundNo, B, "balanced");
        rolls.then(HIT, MISS);
        service.swing(matchId, roundNo, A);
        service.swing(matchId, roundNo, B);
        service.stop(matchId, roundNo, A);
        service.stop(matchId, roundNo, B);
    }

    private String newMatchInSwing(String styleA, String styleB) {
        String matchId = service.createMatch(A, B).getMatchId();
        service.lockStyle(matchId, 1, A, styleA);
        service.lockStyle(matchId, 1, B, styleB);
        return matchId;
    }

    private static void rejected(Runnable action, RejectReason reason) {
        assertThatThrownBy(action::run)
                .isInstanceOf(DuelRejectedException.class)
                .satisfies(e -> assertThat(((DuelRejectedException) e).getReason()).isEqualTo(reason));
    }

    // ---------------- 对局 ----------------

    @Test
    void createMatchOpensFirstRoundWithStyleDeadline() {
        MatchView view = service.createMatch(A, B);

        assertThat(view.getStatus()).isEqualTo(MatchStatus.FIGHTING);
        assertThat(view.getCurrentRound()).isEqualTo(1);
        assertThat(view.getCurrentPhase()).isEqualTo(RoundPhase.STYLE_SELECT);
        assertThat(view.getBar()).isEqualTo(50.0);
        assertThat(view.getParticipants()).containsEntry(Side.A, A).containsEntry(Side.B, B);

        ManualCountdownScheduler.Armed armed = scheduler.armed("duel:" + view.getMatchId());
        assertThat(armed.deadlineEpochMs()).isEqualTo(clock.millis() + 10_000);
        assertThat(armed.owner()).isEqualTo("STYLE_SELECT#1");
    }

    @Test
    void createMatchRejectsInvalidPairing() {
        rejected(() -> service.createMatch(A, A), RejectReason.INVALID_PAIRING);
        rejected(() -> service.createMatch(A, " "), RejectReason.INVALID_PAIRING);
        assertThatThrownBy(() -> service.createMatch(null, B)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownMatchRoundOrParticipantIsRejected() {
        String matchId = service.createMatch(A, B).getMatchId();
        rejected(() -> service.swing("nope", 1, A), RejectReason.MATCH_NOT_FOUND);
        rejected(() -> service.swing(matchId, 7, A), RejectReason.ROUND_NOT_FOUND);
        rejected(() -> service.swing(matchId, 1, "mallory"), RejectReason.NOT_A_PARTICIPANT);
    }

    // ---------------- 选流派 ----------------

    @Test
    void bothLocksEnterSwingAndRevealStyles() {
        String matchId = service.createMatch(A, B).getMatchId();

        LockStyleResult first = service.lockStyle(matchId, 1, A, "Aggressive");
        assertThat(first.lockedStyle()).isEqualTo("aggressive");
        assertThat(first.opponentLocked()).isFalse();
        assertThat(first.phase()).isEqualTo(RoundPhase.STYLE_SELECT);

        // 对手流派在双方都锁定前不可见
        RoundStateView bobView = service.getRoundState(matchId, 1, B);
        assertThat(bobView.getParticipants().get(Side.A).isStyleLocked()).isTrue();
        assertThat(bobView.getParticipants().get(Side.A).getStyle()).isNull();
        assertThat(service.getRoundState(matchId, 1, A).getParticipants().get(Side.A).getStyle()).isEqualTo("aggressive");

        LockStyleResult second = service.lockStyle(matchId, 1, B, "guard");
        assertThat(second.opponentLocked()).isTrue();
        assertThat(second.phase()).isEqualTo(RoundPhase.SWING);

        RoundStateView after = service.getRoundState(matchId, 1, B);
        assertThat(after.getParticipants().get(Side.A).getStyle()).isEqualTo("aggressive");
        assertThat(after.getParticipants().get(Side.A).getSwingCap()).isEqualTo(4);
        assertThat(after.getParticipants().get(Side.B).getSwingCap()).isEqualTo(2);
        assertThat(after.getSwingDeadlineEpochMs()).isEqualTo(clock.millis() + 30_000);
        assertThat(scheduler.armed("duel:" + matchId).owner()).isEqualTo("SWING#1");
        assertThat(publisher.deliveries(DuelMessages.EVT_SWING_STARTED)).hasSize(2);
    }

    @Test
    void ownOddsAreVisibleOnlyToSelf() {
        String matchId = newMatchInSwing("aggressive", "guard");

        RoundStateView.ParticipantView aliceSelf = service.getRoundState(matchId, 1, A).getParticipants().get(Side.A);
        assertThat(aliceSelf.getOdds().critChance()).isCloseTo(0.10, within(1e-9));
        assertThat(aliceSelf.getOdds().hitChance()).isCloseTo(0.316, within(1e-9));
        assertThat(aliceSelf.getOdds().missChance()).isCloseTo(0.584, within(1e-9));

        assertThat(service.getRoundState(matchId, 1, B).getParticipants().get(Side.A).getOdds()).isNull();
    }

    @Test
    void styleRejectionsLeaveStateUntouched() {
        String matchId = service.createMatch(A, B).getMatchId();
        rejected(() -> service.lockStyle(matchId, 1, A, "berserk"), RejectReason.UNKNOWN_STYLE);
        service.lockStyle(matchId, 1, A, "power");
        rejected(() -> service.lockStyle(matchId, 1, A, "feint"), RejectReason.ALREADY_LOCKED);
        rejected(() -> service.swing(matchId, 1, A), RejectReason.WRONG_PHASE);

        RoundStateView view = service.getRoundState(matchId, 1, A);
        assertThat(view.getPhase()).isEqualTo(RoundPhase.STYLE_SELECT);
        assertThat(view.getParticipants().get(Side.A).getStyle()).isEqualTo("power");
        assertThat(view.getParticipants().get(Side.B).isStyleLocked()).isFalse();
    }

    @Test
    void styleDeadlineDefaultsUnlockedParticipant() {
        String matchId = service.createMatch(A, B).getMatchId();
        service.lockStyle(matchId, 1, A, "power");

        scheduler.fire("duel:" + matchId);

        RoundStateView view = service.getRoundState(matchId, 1, A);
        assertThat(view.getPhase()).isEqualTo(RoundPhase.SWING);
        assertThat(view.getParticipants().get(Side.B).getStyle()).isEqualTo("balanced");
        assertThat(view.getParticipants().get(Side.B).getStyleDefaulted()).isTrue();
        assertThat(view.getParticipants().get(Side.A).getStyleDefaulted()).isFalse();
    }

    @Test
    void staleDeadlineIsIgnored() {
        String matchId = service.createMatch(A, B).getMatchId();
        ManualCountdownScheduler.Armed styleTimer = scheduler.armed("duel:" + matchId);
        service.lockStyle(matchId, 1, A, "power");
        service.lockStyle(matchId, 1, B, "guard");

        scheduler.fire(styleTimer);

        RoundStateView view = service.getRoundState(matchId, 1, A);
        assertThat(view.getPhase()).isEqualTo(RoundPhase.SWING);
        assertThat(view.getParticipants().get(Side.B).getStyle()).isEqualTo("guard");
        assertThat(scheduler.armed("duel:" + matchId).owner()).isEqualTo("SWING#1");
    }

    // ---------------- 出手 / 收手 ----------------

    @Test
    void swingReturnsOutcomeAndKeepsRollPrivate() {
        String matchId = newMatchInSwing("balanced", "balanced");
        rolls.then(CRIT, MISS);

        SwingResult first = service.swing(matchId, 1, A);
        assertThat(first.outcome()).isEqualTo(Tier.CRITICAL);
        assertThat(first.swingsUsed()).isEqualTo(1);
        assertThat(first.swingsRemaining()).isEqualTo(2);

        SwingResult second = service.swing(matchId, 1, A);
        assertThat(second.outcome()).isEqualTo(Tier.MISS);
        assertThat(second.bestOutcomeSoFar()).isEqualTo(Tier.MISS);

        assertThat(service.getRoundState(matchId, 1, A).getParticipants().get(Side.A).getCurrentRoll()).isEqualTo(Tier.MISS);
        RoundStateView.ParticipantView seenByBob = service.getRoundState(matchId, 1, B).getParticipants().get(Side.A);
        assertThat(seenByBob.getCurrentRoll()).isNull();
        assertThat(seenByBob.getSwingsUsed()).isEqualTo(2);
    }

    @Test
    void rejectedSwingConsumesNoEntropy() {
        String matchId = newMatchInSwing("guard", "balanced");
        rolls.then(HIT, HIT, HIT);
        service.swing(matchId, 1, A);
        service.swing(matchId, 1, A);
        rejected(() -> service.swing(matchId, 1, A), RejectReason.SWING_CAP_REACHED);
        assertThat(rolls.remaining()).isEqualTo(1);
    }

    @Test
    void stopRejections() {
        String matchId = newMatchInSwing("balanced", "balanced");
        rejected(() -> service.stop(matchId, 1, A), RejectReason.NO_SWINGS_TAKEN);
        rolls.then(HIT);
        service.swing(matchId, 1, A);
        service.stop(matchId, 1, A);
        rejected(() -> service.stop(matchId, 1, A), RejectReason.ALREADY_SUBMITTED);
        rejected(() -> service.swing(matchId, 1, A), RejectReason.ALREADY_SUBMITTED);
    }

    @Test
    void secondStopResolvesAndBroadcastsOncePerParticipant() throws Exception {
        String matchId = newMatchInSwing("aggressive", "guard");
        rolls.then(HIT, MISS);
        service.swing(matchId, 1, A);
        service.swing(matchId, 1, B);

        StopResult first = service.stop(matchId, 1, A);
        assertThat(first.roundResolved()).isFalse();
        assertThat(first.outcome()).isNull();
        assertThat(publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED)).isEmpty();

        StopResult second = service.stop(matchId, 1, B);
        assertThat(second.roundResolved()).isTrue();
        RoundOutcome outcome = second.outcome();
        assertThat(outcome.winnerId()).isEqualTo(A);
        assertThat(outcome.tierA()).isEqualTo(Tier.HIT);
        assertThat(outcome.tierB()).isEqualTo(Tier.MISS);
        assertThat(outcome.push()).isEqualTo(10.0);
        assertThat(outcome.tieBreakUsed()).isFalse();

        assertThat(publisher.count(A, DuelMessages.EVT_ROUND_RESOLVED, 1)).isEqualTo(1);
        assertThat(publisher.count(B, DuelMessages.EVT_ROUND_RESOLVED, 1)).isEqualTo(1);

        // 同步响应与广播是同一份载荷
        ObjectMapper mapper = new ObjectMapper();
        for (var d : publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED)) {
            assertThat(d.event().getPayload()).isSameAs(outcome);
            assertThat(mapper.writeValueAsBytes(d.event().getPayload())).isEqualTo(mapper.writeValueAsBytes(outcome));
        }

        assertThat(archive.find(matchId, 1)).containsSame(outcome);
        MatchView match = service.getMatch(matchId);
        assertThat(match.getBar()).isEqualTo(40.0);
        assertThat(match.getCurrentRound()).isEqualTo(2);
        assertThat(match.getCurrentPhase()).isEqualTo(RoundPhase.STYLE_SELECT);
        assertThat(scheduler.armed("duel:" + matchId).owner()).isEqualTo("STYLE_SELECT#2");
    }

    @Test
    void readsAfterResolutionReturnTheSameOutcomeWithoutSideEffects() {
        String matchId = newMatchInSwing("feint", "balanced");
        rolls.then(CRIT, CRIT);
        service.swing(matchId, 1, A);
        service.swing(matchId, 1, B);
        service.stop(matchId, 1, A);
        RoundOutcome outcome = service.stop(matchId, 1, B).outcome();
        assertThat(outcome.winnerSide()).isEqualTo(Side.A);
        assertThat(outcome.tieBreakUsed()).isTrue();

        int before = publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED).size();
        for (int i = 0; i < 5; i++) {
            RoundStateView view = service.getRoundState(matchId, 1, i % 2 == 0 ? A : null);
            assertThat(view.getOutcome()).isSameAs(outcome);
            assertThat(view.getParticipants().get(Side.B).getBestOutcome()).isEqualTo(Tier.CRITICAL);
        }
        assertThat(publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED)).hasSize(before);
        rejected(() -> service.swing(matchId, 1, A), RejectReason.ROUND_RESOLVED);
    }

    @Test
    void swingDeadlineForcesSubmission() {
        String matchId = newMatchInSwing("balanced", "balanced");
        rolls.then(HIT);
        service.swing(matchId, 1, A);

        scheduler.fire("duel:" + matchId);

        RoundStateView view = service.getRoundState(matchId, 1, null);
        assertThat(view.getPhase()).isEqualTo(RoundPhase.RESOLVED);
        assertThat(view.getParticipants().get(Side.A).getBestOutcome()).isEqualTo(Tier.HIT);
        assertThat(view.getParticipants().get(Side.A).isForcedSubmit()).isTrue();
        assertThat(view.getParticipants().get(Side.B).getBestOutcome()).isEqualTo(Tier.MISS);
        assertThat(view.getParticipants().get(Side.B).isForcedSubmit()).isTrue();
        assertThat(view.getOutcome().winnerId()).isEqualTo(A);
        assertThat(publisher.count(A, DuelMessages.EVT_ROUND_RESOLVED, 1)).isEqualTo(1);
        assertThat(publisher.count(B, DuelMessages.EVT_ROUND_RESOLVED, 1)).isEqualTo(1);
    }

    @Test
    void drawLeavesBarUnchanged() {
        String matchId = newMatchInSwing("balanced", "power");
        rolls.then(HIT, HIT);
        service.swing(matchId, 1, A);
        service.swing(matchId, 1, B);
        service.stop(matchId, 1, A);
        RoundOutcome outcome = service.stop(matchId, 1, B).outcome();

        assertThat(outcome.draw()).isTrue();
        assertThat(outcome.push()).isZero();
        assertThat(service.getMatch(matchId).getBar()).isEqualTo(50.0);
    }

    @Test
    void reachingTheBarEndFinishesTheMatch() {
        props.getBar().setStart(10.0);
        String matchId = newMatchInSwing("balanced", "balanced");
        rolls.then(MISS, HIT);
        service.swing(matchId, 1, A);
        service.swing(matchId, 1, B);
        service.stop(matchId, 1, A);
        service.stop(matchId, 1, B);
        assertThat(service.getMatch(matchId).getStatus()).isEqualTo(MatchStatus.FIGHTING);
        assertThat(service.getMatch(matchId).getBar()).isEqualTo(20.0);

        props.getBar().setStart(95.0);
        String other = newMatchInSwing("balanced", "balanced");
        rolls.then(MISS, HIT);
        service.swing(other, 1, A);
        service.swing(other, 1, B);
        service.stop(other, 1, A);
        service.stop(other, 1, B);

        MatchView ended = service.getMatch(other);
        assertThat(ended.getStatus()).isEqualTo(MatchStatus.COMPLETE);
        assertThat(ended.getWinnerId()).isEqualTo(B);
        assertThat(ended.getBar()).isEqualTo(100.0);
        assertThat(ended.getCurrentRound()).isEqualTo(1);
        assertThat(scheduler.isActive("duel:" + other)).isFalse();
        assertThat(publisher.deliveries(DuelMessages.EVT_MATCH_ENDED)).hasSize(2);
    }

    // ---------------- 致命错误 / 协作方失败 ----------------

    @Test
    void randomSourceFailureAbortsRoundWithoutBroadcast() {
        String matchId = newMatchInSwing("balanced", "balanced");
        rolls.failWith(new IllegalStateException("entropy exhausted"));

        assertThatThrownBy(() -> service.swing(matchId, 1, A))
                .isInstanceOf(UnresolvableRoundException.class)
                .hasMessageStartingWith("ROUND_UNRESOLVABLE");

        assertThat(service.getRoundState(matchId, 1, null).getPhase()).isEqualTo(RoundPhase.ABORTED);
        assertThat(service.getMatch(matchId).getStatus()).isEqualTo(MatchStatus.UNRESOLVABLE);
        assertThat(scheduler.isActive("duel:" + matchId)).isFalse();
        assertThat(publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED)).isEmpty();
        rejected(() -> service.stop(matchId, 1, B), RejectReason.ROUND_ABORTED);
    }

    @Test
    void archiveFailureDoesNotBlockResolution() {
        RoundOutcomeRepository broken = mock(RoundOutcomeRepository.class);
        doThrow(new IllegalStateException("redis down")).when(broken).save(any());
        service = newService(broken);

        String matchId = newMatchInSwing("balanced", "balanced");
        rolls.then(HIT, MISS);
        service.swing(matchId, 1, A);
        service.swing(matchId, 1, B);
        service.stop(matchId, 1, A);

        assertThat(service.stop(matchId, 1, B).roundResolved()).isTrue();
        assertThat(publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED)).hasSize(2);
    }

    // ---------------- 保留期清理 ----------------

    @Test
    void finishedMatchesAreEvictedAfterRetention() {
        props.getBar().setStart(10.0);
        String done = service.createMatch(A, B).getMatchId();
        playRoundWonByA(done, 1);
        assertThat(service.getMatch(done).getStatus()).isEqualTo(MatchStatus.COMPLETE);

        String fighting = service.createMatch(A, B).getMatchId();
        long retention = props.getRetention().getFinished().toMillis();

        assertThat(service.evictFinished(clock.millis() + retention)).isZero();
        assertThat(service.getMatch(done).getStatus()).isEqualTo(MatchStatus.COMPLETE);

        assertThat(service.evictFinished(clock.millis() + retention + 1)).isEqualTo(1);
        rejected(() -> service.getMatch(done), RejectReason.MATCH_NOT_FOUND);
        rejected(() -> service.getRoundState(done, 1, A), RejectReason.MATCH_NOT_FOUND);
        verify(dispatcher).forget(done);
        verify(dispatcher, never()).forget(fighting);
        assertThat(service.getMatch(fighting).getStatus()).isEqualTo(MatchStatus.FIGHTING);
    }

    @Test
    void unresolvableMatchesAreEvictedToo() {
        String matchId = newMatchInSwing("balanced", "balanced");
        rolls.failWith(new IllegalStateException("entropy exhausted"));
        assertThatThrownBy(() -> service.swing(matchId, 1, A)).isInstanceOf(UnresolvableRoundException.class);

        service.evictFinished(clock.millis() + props.getRetention().getFinished().toMillis() + 1);

        rejected(() -> service.getMatch(matchId), RejectReason.MATCH_NOT_FOUND);
        verify(dispatcher).forget(matchId);
    }

    @Test
    void evictionClearsTheDeliveryLedger() {
        props.getBar().setStart(10.0);
        String matchId = service.createMatch(A, B).getMatchId();
        playRoundWonByA(matchId, 1);

        service.evictFinished(clock.millis() + props.getRetention().getFinished().toMillis() + 1);

        // 台账随对局一起清理，这时再重放同一结果会重新投递，说明台账条目已不存在
        RoundOutcome outcome = archive.find(matchId, 1).orElseThrow();
        DuelMatch ghost = new DuelMatch(matchId, A, B, () -> 0.5, 50, 0, 100, 0L);
        assertThat(dispatcher.roundResolved(ghost, outcome)).isEqualTo(2);
    }

    // ---------------- 计时 ----------------

    @Test
    void zeroLengthPhasesDoNotRunTimeoutsOnTheCallerThread() throws Exception {
        props.getStyle().setSeconds(0);
        props.getSwing().setSeconds(0);
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1);
        CountDownLatch gate = new CountDownLatch(1);
        try {
            service = newService(archive, new CountdownSchedulerImpl(pool, clock));
            // 先堵住计时线程，createMatch 返回前不会有任何到期处理
            pool.execute(() -> {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            MatchView view = service.createMatch(A, B);

            assertThat(view.getCurrentRound()).isEqualTo(1);
            assertThat(view.getCurrentPhase()).isEqualTo(RoundPhase.STYLE_SELECT);
            assertThat(publisher.deliveries(DuelMessages.EVT_SWING_STARTED)).isEmpty();

            gate.countDown();
            long deadline = System.currentTimeMillis() + 3000;
            while (service.getRoundState(view.getMatchId(), 1, null).getPhase() == RoundPhase.STYLE_SELECT
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(service.getRoundState(view.getMatchId(), 1, null).getPhase())
                    .isNotEqualTo(RoundPhase.STYLE_SELECT);
        } finally {
            gate.countDown();
            pool.shutdownNow();
        }
    }

    // ---------------- 并发 ----------------

    @Test
    void concurrentStopsResolveExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 50; i++) {
                String matchId = newMatchInSwing("balanced", "balanced");
                rolls.then(HIT, MISS);
                service.swing(matchId, 1, A);
                service.swing(matchId, 1, B);

                CountDownLatch go = new CountDownLatch(1);
                List<Future<StopResult>> results = new ArrayList<>();
                for (String pid : new String[]{A, B}) {
                    results.add(pool.submit(() -> {
                        go.await();
                        return service.stop(matchId, 1, pid);
                    }));
                }
                go.countDown();

                List<StopResult> done = new ArrayList<>();
                for (Future<StopResult> f : results) {
                    done.add(f.get());
                }
                assertThat(done).filteredOn(StopResult::roundResolved).hasSize(1);
                RoundOutcome outcome = done.stream().filter(StopResult::roundResolved).findFirst().orElseThrow().outcome();
                assertThat(service.getRoundState(matchId, 1, null).getOutcome()).isSameAs(outcome);
                assertThat(publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED))
                        .filteredOn(d -> matchId.equals(d.event().getMatchId()))
                        .hasSize(2)
                        .allSatisfy(d -> assertThat(d.event().getPayload()).isSameAs(outcome));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentStopAndDeadlineResolveExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 50; i++) {
                String matchId = newMatchInSwing("balanced", "balanced");
                rolls.then(HIT, MISS);
                service.swing(matchId, 1, A);
                service.swing(matchId, 1, B);
                service.stop(matchId, 1, A);
                ManualCountdownScheduler.Armed swingTimer = scheduler.armed("duel:" + matchId);

                CountDownLatch go = new CountDownLatch(1);
                Future<?> timer = pool.submit(() -> {
                    go.await();
                    scheduler.fire(swingTimer);
                    return null;
                });
                Future<Object> stop = pool.submit(() -> {
                    go.await();
                    try {
                        return service.stop(matchId, 1, B);
                    } catch (DuelRejectedException e) {
                        return e.getReason();
                    }
                });
                go.countDown();
                timer.get();
                Object stopResult = stop.get();

                if (stopResult instanceof StopResult r) {
                    assertThat(r.roundResolved()).isTrue();
                } else {
                    assertThat(stopResult).isEqualTo(RejectReason.ROUND_RESOLVED);
                }
                for (String pid : new String[]{A, B}) {
                    assertThat(publisher.deliveries(DuelMessages.EVT_ROUND_RESOLVED))
                            .filteredOn(d -> matchId.equals(d.event().getMatchId()) && pid.equals(d.participantId()))
                            .hasSize(1);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
