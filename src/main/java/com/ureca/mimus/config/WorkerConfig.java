package com.ureca.mimus.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 워커 루프 전용 Executor
 * <p>
 * 한 프로세스에 워커 루프 하나 (메시지를 하나씩 순서대로 처리)
 * 처리량은 워커 프로세스 수로 늘린다
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "mimus.worker", name = "enabled", havingValue = "true")
public class WorkerConfig {

    public static final String WORKER_EXECUTOR_NAME = "workerExecutor";

    @Bean(name = WORKER_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor workerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("Worker-");

        // 진행 중인 메시지는 끝내고 종료
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(35);

        executor.initialize();

        log.info("[Worker] Executor 초기화 완료");
        return executor;
    }
}
