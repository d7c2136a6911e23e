package com.duelhub.duelservice.games.duel.application;

import com.duelhub.duelservice.clock.scheduler.CountdownScheduler;
import com.duelhub.duelservice.games.duel.domain.constants.DuelMessages;
import com.duelhub.duelservice.games.duel.domain.dto.DuelEventPayloads;
import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.model.DuelRound;
import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * RoundClockCoordinator
 * -------------------------------------------------
 * 回合计时协调器（应用编排层）：把通用倒计时引擎与回合阶段对接。
 *
 * 1) 启动时注册 tick 监听，转成对局主题上的 TICK 事件；
 * 2) 回合进入选流派/出手阶段时挂上对应截止时间；
 * 3) 到期时把 (matchId, roundNo, phase) 交给上层处理器，由处理器在回合锁内判断是否过期回调。
 *
 * 同一对局同时只有一个活动回合，因此计时键按对局划分。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoundClockCoordinator {

    private static final String KEY_PREFIX = "duel:";

    private final CountdownScheduler scheduler;
    private final DuelEventPublisher publisher;

    /**
     * 到期处理器。
     */
    @FunctionalInterface
    public interface DeadlineHandler {
        void onDeadline(String matchId, int roundNo, RoundPhase phase);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("回合计时协调器启动：注册 TICK 监听");
        scheduler.setTickListener((key, owner, deadlineMs, left) -> {
            String matchId = extractMatchId(key);
            String[] parts = owner.split("#", 2);
            DuelEventPayloads.Tick tick = new DuelEventPayloads.Tick(Integer.parseInt(parts[1]), parts[0], deadlineMs, left);
            publisher.toMatch(matchId, BroadcastEvent.of(matchId, tick.roundNo(), DuelMessages.EVT_TICK, tick));
        });
    }

    /** 挂上选流派截止时间 */
    public void armStyleDeadline(DuelRound round, DeadlineHandler handler) {
        arm(round, RoundPhase.STYLE_SELECT, round.styleDeadlineEpochMs(), handler);
    }

    /** 挂上出手阶段截止时间 */
    public void armSwingDeadline(DuelRound round, DeadlineHandler handler) {
        arm(round, RoundPhase.SWING, round.swingDeadlineEpochMs(), handler);
    }

    /** 取消对局当前的计时 */
    public void cancel(String matchId) {
        scheduler.stop(key(matchId));
    }

    private void arm(DuelRound round, RoundPhase phase, long deadline, DeadlineHandler handler) {
        String matchId = round.matchId();
        // owner 携带阶段与回合号，TICK 与到期回调都能还原
        String owner = phase.name() + "#" + round.roundNo();
        scheduler.start(key(matchId), owner, deadline, String.valueOf(round.roundNo()),
                (k, o, v) -> handler.onDeadline(extractMatchId(k), Integer.parseInt(v), RoundPhase.valueOf(o.split("#", 2)[0])));
        log.debug("挂上截止时间 match={} round={} phase={} deadline={}", matchId, round.roundNo(), phase, deadline);
    }

    private static String key(String matchId) {
        return KEY_PREFIX + matchId;
    }

    private static String extractMatchId(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }
}
