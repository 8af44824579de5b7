package com.aitimeline.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 업스케일 작업 전용 스레드 풀
 * 큐가 가득 차면 호출 스레드에서 실행해 작업이 버려지지 않도록 한다.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String ENHANCEMENT_EXECUTOR = "enhancementExecutor";

    @Value("${enhancement.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${enhancement.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${enhancement.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = ENHANCEMENT_EXECUTOR)
    public Executor enhancementExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("enhance-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.info("Enhancement executor initialized (core={}, max={}, queue={})", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
