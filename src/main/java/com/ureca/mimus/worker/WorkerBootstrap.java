package com.ureca.mimus.worker;

import com.ureca.mimus.common.retry.DeadlineRetry;
import com.ureca.mimus.config.WorkerConfig;
import com.ureca.mimus.config.WorkerProperties;
import com.ureca.mimus.statement.StatementBuilder;
import com.ureca.mimus.statement.TableSchema;
import com.ureca.mimus.statement.TableSchemas;
import com.ureca.mimus.worker.exception.DatabaseConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 워커 기동
 * <p>
 * 1. 스키마 레지스트리의 모든 테이블 생성 (IF NOT EXISTS)
 *    - 동시에 뜨는 워커끼리 DDL 이 겹치지 않게 분산 락
 *    - DB 연결 실패는 마감 시간 안에서 재시도, 끝내 실패하면 기동 중단
 * 2. 워커 전용 Executor 에서 QueueWorker 루프 시작
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "mimus.worker", name = "enabled", havingValue = "true")
public class WorkerBootstrap implements ApplicationRunner, DisposableBean {

    static final String SCHEMA_LOCK = "mimus:schema:init";

    private final QueueWorker queueWorker;
    private final JdbcTemplate jdbcTemplate;
    private final StatementBuilder statementBuilder;
    private final RedissonClient redissonClient;
    private final TaskExecutor workerExecutor;
    private final RetryTemplate bootstrapRetryTemplate;

    public WorkerBootstrap(
            QueueWorker queueWorker,
            JdbcTemplate jdbcTemplate,
            StatementBuilder statementBuilder,
            RedissonClient redissonClient,
            @Qualifier(WorkerConfig.WORKER_EXECUTOR_NAME) TaskExecutor workerExecutor,
            WorkerProperties properties,
            Clock clock
    ) {
        this.queueWorker = queueWorker;
        this.jdbcTemplate = jdbcTemplate;
        this.statementBuilder = statementBuilder;
        this.redissonClient = redissonClient;
        this.workerExecutor = workerExecutor;
        this.bootstrapRetryTemplate = DeadlineRetry.template(
                properties.bootstrap().toRetrySettings(), clock, List.of());
    }

    @Override
    public void run(ApplicationArguments args) {
        initializeSchema();
        workerExecutor.execute(queueWorker::run);
        log.info("[Bootstrap] 워커 시작 완료");
    }

    // workerExecutor 보다 먼저 소멸되므로 Executor 가 종료를 기다리기 전에 루프를 멈춘다
    @Override
    public void destroy() {
        queueWorker.shutdown();
    }

    void initializeSchema() {
        RLock lock = redissonClient.getLock(SCHEMA_LOCK);
        boolean acquired = false;

        try {
            // 최대 30초 대기, 획득 시 60초 TTL
            acquired = lock.tryLock(30, 60, TimeUnit.SECONDS);
            if (!acquired) {
                // IF NOT EXISTS 라서 락 없이 진행해도 결과는 같다
                log.warn("[Bootstrap] 스키마 락 획득 실패. 락 없이 진행. lock: {}", SCHEMA_LOCK);
            }

            createTables();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseConnectionException(e);
        } finally {
            if (acquired && lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private void createTables() {
        bootstrapRetryTemplate.execute(
                context -> {
                    if (context.getRetryCount() > 0) {
                        log.warn("[Bootstrap] DB 연결 재시도. attempt: {}, error: {}",
                                context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                    }
                    for (TableSchema schema : TableSchemas.all()) {
                        jdbcTemplate.execute(statementBuilder.createTable(schema));
                        log.info("[Bootstrap] 테이블 준비 완료. table: {}", schema.name());
                    }
                    return null;
                },
                context -> {
                    log.error("[Bootstrap] DB 연결 실패. 기동 중단. attempts: {}", context.getRetryCount());
                    throw new DatabaseConnectionException(context.getLastThrowable());
                });
    }
}
