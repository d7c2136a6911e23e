package com.duelhub.duelservice.clock;

import com.duelhub.duelservice.clock.scheduler.CountdownScheduler;
import com.duelhub.duelservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 把计时线程池与时钟注入通用调度引擎，不涉及对决规则。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public CountdownScheduler countdownScheduler(@Qualifier("duelClockScheduler") ScheduledThreadPoolExecutor duelClockScheduler,
                                                 Clock clock) {
        return new CountdownSchedulerImpl(duelClockScheduler, clock);
    }
}
