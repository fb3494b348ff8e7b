package dev.orderscanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Shared runtime beans: the clock every timestamp is read from and the
 * scheduler ingestion runs are subscribed on.
 */
@Configuration
public class RuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler ingestionScheduler() {
        return Schedulers.boundedElastic();
    }
}
