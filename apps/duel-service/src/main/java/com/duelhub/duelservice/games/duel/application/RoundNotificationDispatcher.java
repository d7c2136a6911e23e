package com.duelhub.duelservice.games.duel.application;

import com.duelhub.duelservice.games.duel.domain.constants.DuelMessages;
import com.duelhub.duelservice.games.duel.domain.dto.DuelEventPayloads;
import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.model.DuelMatch;
import com.duelhub.duelservice.games.duel.domain.model.DuelRound;
import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * RoundNotificationDispatcher
 * -------------------------------------------------
 * 把结算结果推送到双方的私有事件队列。
 *
 * 规则：
 * 1) ROUND_RESOLVED / MATCH_ENDED 对每个参与者每回合（每局）最多投递一次，由投递台账去重；
 * 2) 载荷直接引用回合内的 RoundOutcome，不做二次组装，同步响应拿到的是同一个对象；
 * 3) 同步响应不经过这里，因此不会被重复推送到事件通道；
 * 4) SWING_STARTED 只是提示，不记台账。
 *
 * 某一方投递失败只记 WARN：台账已占位，不会补发，掉线方可通过查询回合状态还原结果。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoundNotificationDispatcher {

    private final DuelEventPublisher publisher;

    // matchId -> 已投递键（R:{roundNo}:{pid} / E:{pid}）
    private final ConcurrentMap<String, Set<String>> ledger = new ConcurrentHashMap<>();

    /**
     * 回合结算广播（每个参与者恰好一次）。
     * @return 本次实际投递的参与者数
     */
    public int roundResolved(DuelMatch match, RoundOutcome outcome) {
        BroadcastEvent evt = BroadcastEvent.of(match.matchId(), outcome.roundNo(),
                DuelMessages.EVT_ROUND_RESOLVED, outcome);
        int sent = 0;
        for (Side side : Side.values()) {
            String pid = match.participantId(side);
            if (claim(match.matchId(), "R:" + outcome.roundNo() + ":" + pid)) {
                deliver(pid, evt);
                sent++;
            } else {
                log.debug("已投递过，跳过 match={} round={} pid={}", match.matchId(), outcome.roundNo(), pid);
            }
        }
        return sent;
    }

    /**
     * 对局结束广播（每个参与者恰好一次）。
     */
    public int matchEnded(DuelMatch match) {
        DuelEventPayloads.MatchEnded payload = new DuelEventPayloads.MatchEnded(
                match.matchId(), match.winnerId(), match.bar(), match.roundCount());
        BroadcastEvent evt = BroadcastEvent.of(match.matchId(), null, DuelMessages.EVT_MATCH_ENDED, payload);
        int sent = 0;
        for (Side side : Side.values()) {
            String pid = match.participantId(side);
            if (claim(match.matchId(), "E:" + pid)) {
                deliver(pid, evt);
                sent++;
            }
        }
        return sent;
    }

    /**
     * 进入出手阶段提示（双方流派此时公开）。
     */
    public void swingStarted(DuelMatch match, DuelRound round) {
        DuelEventPayloads.SwingStarted payload = new DuelEventPayloads.SwingStarted(round.roundNo(),
                round.participant(Side.A).getStyle().getId(),
                round.participant(Side.B).getStyle().getId(),
                round.swingDeadlineEpochMs());
        BroadcastEvent evt = BroadcastEvent.of(match.matchId(), round.roundNo(), DuelMessages.EVT_SWING_STARTED, payload);
        for (Side side : Side.values()) {
            deliver(match.participantId(side), evt);
        }
    }

    /** 对局从内存移除时一并清理台账 */
    public void forget(String matchId) {
        ledger.remove(matchId);
    }

    private boolean claim(String matchId, String key) {
        return ledger.computeIfAbsent(matchId, k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    private void deliver(String participantId, BroadcastEvent evt) {
        try {
            publisher.toParticipant(participantId, evt);
        } catch (RuntimeException e) {
            log.warn("推送失败 type={} match={} pid={}: {}", evt.getType(), evt.getMatchId(), participantId, e.getMessage());
        }
    }
}
