package io.github.orbit.gateway.config;

import io.github.orbit.runtime.config.OrbitProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Three pools: {@code taskScheduler} runs {@code @Scheduled} jobs such as cost
 * reconciliation, {@code scanTriggerScheduler} matches scan cron triggers, and
 * {@code scanFiringExecutor} runs the (blocking) firings those triggers produce.
 *
 * <p>Firings get a thread each: a blocked playbook never delays or rejects another
 * schedule's firing.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("job-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    ThreadPoolTaskScheduler scanTriggerScheduler(OrbitProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.scheduler().poolSize()));
        scheduler.setThreadNamePrefix("schedule-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    SimpleAsyncTaskExecutor scanFiringExecutor() {
        var executor = new SimpleAsyncTaskExecutor("scan-fire-");
        executor.setTaskTerminationTimeout(30_000);
        return executor;
    }
}
