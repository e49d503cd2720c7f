package com.example.commitnotifier.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async work off the notification path.
 * <p>
 * Only operator alerts run here, so a notification cycle never waits on Slack.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Value("${commit-notifier.alert-executor-pool-size:2}")
    private int executorPoolSize;

    /**
     * Task executor for Spring's @Async annotation
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring async executor with {} threads", executorPoolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(executorPoolSize);
        executor.setMaxPoolSize(executorPoolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Alert queue full, dropping alert"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        return executor;
    }
}
