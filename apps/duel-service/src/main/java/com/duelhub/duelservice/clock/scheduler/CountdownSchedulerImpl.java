package com.duelhub.duelservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 倒计时调度引擎的默认实现（进程内）。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 每秒检查一次剩余时间；
 *  - 到期回调只在线程池中执行，从不在 start 的调用线程上执行；
 *  - 暴露 tick/timeout 回调给上层协调器。
 *
 * 回合状态本身只在内存中，因此倒计时不做持久化与重启恢复。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;

    private volatile TickListener tickListener;

    // key -> 任务
    private final ConcurrentMap<String, Countdown> active = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(ScheduledThreadPoolExecutor scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    @Override
    public void start(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        // 防止重复任务
        stop(key);
        Countdown cd = new Countdown(key, owner, version, deadlineEpochMs, onTimeout);
        long remainMs = deadlineEpochMs - clock.millis();
        active.put(key, cd);
        if (remainMs <= 0) {
            // 已过期也交给线程池，调用方可能正持有回合锁
            scheduler.execute(() -> expireNow(cd));
            log.debug("倒计时已过期，立即排队到期处理 key={} owner={} version={}", key, owner, version);
            return;
        }
        // 立即首帧 TICK
        fireTick(cd);
        // 到期检查按 1 秒对齐，最后一段用剩余毫秒精确补齐
        cd.future = scheduler.scheduleAtFixedRate(() -> tickTask(cd),
                Math.min(1000L, remainMs), 1000L, TimeUnit.MILLISECONDS);
        log.debug("倒计时启动 key={} owner={} version={} 剩余{}ms", key, owner, version, remainMs);
    }

    @Override
    public void stop(String key) {
        Countdown cd = active.remove(key);
        if (cd != null) {
            cd.cancel();
        }
    }

    @Override
    public boolean isActive(String key) {
        return active.containsKey(key);
    }

    private void tickTask(Countdown cd) {
        // 已被替换或停止
        if (active.get(cd.key) != cd) {
            cd.cancel();
            return;
        }
        long remainMs = cd.deadlineEpochMs - clock.millis();
        if (remainMs <= 0) {
            if (active.remove(cd.key, cd)) {
                cd.cancel();
                fireTimeout(cd);
            }
            return;
        }
        fireTick(cd);
    }

    private void expireNow(Countdown cd) {
        // 排队期间被 stop 或替换则不再触发
        if (active.remove(cd.key, cd)) {
            fireTimeout(cd);
        }
    }

    private void fireTick(Countdown cd) {
        TickListener l = tickListener;
        if (l == null) return;
        long left = Math.max(0, (cd.deadlineEpochMs - clock.millis() + 999) / 1000);
        try {
            l.onTick(cd.key, cd.owner, cd.deadlineEpochMs, left);
        } catch (RuntimeException e) {
            // TICK 只是展示信息，失败不影响计时
            log.warn("TICK 回调失败 key={}: {}", cd.key, e.getMessage());
        }
    }

    private void fireTimeout(Countdown cd) {
        if (cd.onTimeout == null) return;
        try {
            cd.onTimeout.onTimeout(cd.key, cd.owner, cd.version);
        } catch (RuntimeException e) {
            // 不抛回调度线程，否则周期任务会被静默终止
            log.error("倒计时到期处理失败 key={} owner={} version={}", cd.key, cd.owner, cd.version, e);
        }
    }

    private static final class Countdown {
        final String key;
        final String owner;
        final String version;
        final long deadlineEpochMs;
        final TimeoutHandler onTimeout;
        volatile ScheduledFuture<?> future;

        Countdown(String key, String owner, String version, long deadlineEpochMs, TimeoutHandler onTimeout) {
            this.key = key;
            this.owner = owner;
            this.version = version;
            this.deadlineEpochMs = deadlineEpochMs;
            this.onTimeout = onTimeout;
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }
}
