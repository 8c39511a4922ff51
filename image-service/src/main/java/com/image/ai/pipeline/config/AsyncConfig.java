package com.image.ai.pipeline.config;

import com.image.ai.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = AppConstants.PIPELINE_EXECUTOR)
    public ThreadPoolTaskExecutor imagePipelineExecutor(
            @Value(AppConstants.PROP_EXECUTOR_POOL_SIZE) int poolSize) {
        log.info("Initializing pipeline executor with {} threads", poolSize);
        // unbounded queue: an accepted image always gets its run, however long the backlog
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix(AppConstants.PIPELINE_THREAD_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
