package com.duelhub.duelservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 回合计时线程池。
 *
 * 1. 核心线程数取自 scheduler.clock.core-pool-size；
 * 2. 线程命名为 duel-clock-N，便于日志排查；
 * 3. 守护线程，JVM 退出时不等待；
 * 4. 取消的任务立即从队列移除。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.core-pool-size:2}")
    private int corePoolSize;

    @Bean(name = "duelClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor duelClockScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "duel-clock-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.AbortPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
