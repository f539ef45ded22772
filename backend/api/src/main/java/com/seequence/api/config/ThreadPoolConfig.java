package com.seequence.api.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 스레드 풀
 * - generationExecutor: 장면별 이미지/나레이션 호출 (요청당 동시 이미지 수는 Semaphore가 따로 제한)
 * - streamExecutor: SSE 파이프라인 실행. 오래 점유하므로 generationExecutor와 분리한다.
 */
@Configuration
@RequiredArgsConstructor
public class ThreadPoolConfig {

    public static final String GENERATION_EXECUTOR = "generationExecutor";
    public static final String STREAM_EXECUTOR = "streamExecutor";

    private final SeequenceProperties properties;

    @Bean(name = GENERATION_EXECUTOR)
    public ThreadPoolTaskExecutor generationExecutor() {
        SeequenceProperties.Executor props = properties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        // 풀과 큐가 가득 차면 호출 스레드에서 실행
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * 가득 차면 거부 (TaskRejectedException). 호출 스레드에서 스트림 전체를 돌리지 않는다.
     */
    @Bean(name = STREAM_EXECUTOR)
    public ThreadPoolTaskExecutor streamExecutor() {
        SeequenceProperties.Executor props = properties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getStreamPoolSize());
        executor.setMaxPoolSize(props.getStreamPoolSize());
        executor.setQueueCapacity(props.getStreamQueueCapacity());
        executor.setThreadNamePrefix(props.getStreamThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
