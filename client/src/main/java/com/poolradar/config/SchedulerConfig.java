package com.poolradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool (2 threads) for pool price monitors.
 */
@Configuration(proxyBeanMethods = false)
public class SchedulerConfig {

    public static final String MONITOR_SCHEDULER = "monitor-scheduler";

    @Bean(name = MONITOR_SCHEDULER)
    public ThreadPoolTaskScheduler monitorScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("monitor-");
        s.initialize();
        return s;
    }
}
