package com.zust.backend.media.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Background pool for account media work (directory creation, avatar download).
 * Bounded so a burst of sign-ups cannot exhaust threads; overflow runs on the caller.
 */
@Configuration
@EnableAsync
@EnableConfigurationProperties(MediaProperties.class)
public class MediaModuleConfig {

    public static final String MEDIA_EXECUTOR = "mediaTaskExecutor";

    @Bean(name = MEDIA_EXECUTOR)
    public Executor mediaTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("media-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
