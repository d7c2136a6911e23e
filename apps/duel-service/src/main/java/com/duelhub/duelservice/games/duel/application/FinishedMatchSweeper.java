package com.duelhub.duelservice.games.duel.application;

import com.duelhub.duelservice.games.duel.service.DuelService;
import com.duelhub.duelservice.platform.config.DuelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 已终局对局清理任务：复用回合计时线程池，按 duel.retention.sweep-interval 周期执行。
 */
@Slf4j
@Component
public class FinishedMatchSweeper {

    private final DuelService duelService;
    private final ScheduledThreadPoolExecutor executor;
    private final DuelProperties props;
    private final Clock clock;

    public FinishedMatchSweeper(DuelService duelService,
                                @Qualifier("duelClockScheduler") ScheduledThreadPoolExecutor executor,
                                DuelProperties props,
                                Clock clock) {
        this.duelService = duelService;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        long interval = props.getRetention().getSweepInterval().toMillis();
        executor.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("终局对局清理任务启动：间隔 {}ms，保留 {}", interval, props.getRetention().getFinished());
    }

    /** 单次清理；异常不抛回线程池，否则周期任务会被终止 */
    void sweep() {
        try {
            duelService.evictFinished(clock.millis());
        } catch (RuntimeException e) {
            log.error("终局对局清理失败", e);
        }
    }
}
