package ch.crossword.crosswordbackend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the disconnect grace period checks of {@code WebSocketEventListener}.
 */
@Configuration
public class SchedulingConfig {

    /**
     * Builds the pool that runs the delayed presence checks after a socket drops.
     *
     * <p>Worker threads are named {@code crossword-scheduler-N} so they stand out in thread dumps.
     *
     * @param poolSize number of worker threads, from {@code crossword.scheduler.pool-size}
     * @return an initialized {@link ThreadPoolTaskScheduler}
     */
    @Bean
    public TaskScheduler taskScheduler(@Value("${crossword.scheduler.pool-size:5}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("crossword-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
