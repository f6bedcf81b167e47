package org.gc.freegames.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Slf4j
@Configuration
public class SchedulerConfig {

    /**
     * Single thread: job ticks never run concurrently with each other.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("push-tick-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(error -> log.error("Unhandled error in push tick: {}", error.getMessage(), error));
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
