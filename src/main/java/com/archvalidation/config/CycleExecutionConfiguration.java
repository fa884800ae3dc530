package com.archvalidation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Worker pool of validation cycles and the service clock.
 *
 * The pool is bounded; a full queue rejects new cycles instead of letting
 * them pile up.
 */
@Configuration
@Slf4j
public class CycleExecutionConfiguration {

    @Bean(name = "validationCycleExecutor")
    public ThreadPoolTaskExecutor validationCycleExecutor(ValidationProperties properties) {
        ValidationProperties.Cycle cycle = properties.getCycle();
        log.info("Configuring validation cycle executor: poolSize={}, queueCapacity={}, timeout={}",
            cycle.getPoolSize(), cycle.getQueueCapacity(), cycle.getTimeout());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cycle.getPoolSize());
        executor.setMaxPoolSize(cycle.getPoolSize());
        executor.setQueueCapacity(cycle.getQueueCapacity());
        executor.setThreadNamePrefix("validation-cycle-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
