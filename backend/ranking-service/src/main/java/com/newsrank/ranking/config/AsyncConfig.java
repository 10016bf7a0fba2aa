package com.newsrank.ranking.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.ranking.core-pool-size:4}")
    private int corePoolSize;

    @Value("${async.ranking.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${async.ranking.queue-capacity:200}")
    private int queueCapacity;

    /**
     * 랭킹 파이프라인 전용 실행자
     * (유사도 행렬 계산, 무결성/신뢰도/인기도 스코어러 병렬 실행)
     *
     * 큐가 가득 차면 호출 스레드에서 실행하여 작업이 유실되지 않도록 합니다.
     */
    @Bean(name = "rankingExecutor")
    public Executor rankingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ranking-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from rankingExecutor, running on caller thread: {}", r);
            new ThreadPoolExecutor.CallerRunsPolicy().rejectedExecution(r, e);
        });
        executor.initialize();
        return executor;
    }

    /**
     * 신선도/트렌딩 계산 기준 시계
     */
    @Bean
    public Clock rankingClock() {
        return Clock.systemUTC();
    }
}
