package com.ureca.mimus.worker;

import com.ureca.mimus.common.telemetry.RequestTimers;
import com.ureca.mimus.config.WorkerProperties;
import com.ureca.mimus.transaction.dto.QueryBatch;
import com.ureca.mimus.transaction.dto.QueryEntry;
import com.ureca.mimus.transaction.dto.ResultEnvelope;
import com.ureca.mimus.worker.exception.BatchRollbackException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * 쿼리 배치 하나를 DB 트랜잭션 하나로 실행
 * <p>
 * 격리 수준 READ_UNCOMMITTED, 문은 배치 순서대로 실행
 * 커밋 시간을 따로 재야 해서 @Transactional 대신 트랜잭션 매니저를 직접 사용
 * <p>
 * 무결성 위반 (중복 키 등):
 * - NON_ATOMIC : 로그 남기고 해당 문만 건너뜀, 나머지는 커밋
 * - ATOMIC : 전체 롤백 후 BatchRollbackException
 * 그 밖의 예외는 롤백 후 그대로 던진다
 */
@Slf4j
@Component
public class BatchExecutor {

    private static final int FIRST_STATEMENT_NUMBER = 100;

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;
    private final BatchExecutionMode mode;

    @Autowired
    public BatchExecutor(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            WorkerProperties workerProperties
    ) {
        this(jdbcTemplate, transactionManager, workerProperties.executionMode());
    }

    public BatchExecutor(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            BatchExecutionMode mode
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionManager = transactionManager;
        this.mode = mode;
    }

    /**
     * @param uniqId 로그/타이머 이름에 쓰는 srv_id:trans_id
     * @param timers 문별 실행 시간과 커밋 시간을 기록할 요청 타이머
     */
    public BatchExecutionResult execute(QueryBatch batch, String uniqId, RequestTimers timers) {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_UNCOMMITTED);
        definition.setName("mimus-batch:" + uniqId);

        TransactionStatus status = transactionManager.getTransaction(definition);

        Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
        int affected = 0;
        int failed = 0;
        int number = FIRST_STATEMENT_NUMBER;

        try {
            for (QueryEntry entry : batch.queries()) {
                String timerName = statementTimerName(number++, entry, uniqId);
                timers.start(timerName);
                try {
                    StatementOutcome outcome = executeStatement(entry);
                    appendRows(results, entry, outcome.rows(), uniqId);
                    affected += outcome.updateCount();
                    log.debug("[Worker] 실행 완료. affected: {}, statement: '{}'", outcome.updateCount(), entry.statement());
                } catch (DataIntegrityViolationException e) {
                    if (mode == BatchExecutionMode.ATOMIC) {
                        throw new BatchRollbackException(uniqId, entry.statement(), e);
                    }
                    failed++;
                    log.error("[Worker] 무결성 위반. 해당 문 건너뜀. uniqId: {}, statement: '{}', error: {}",
                            uniqId, entry.statement(), e.getMostSpecificCause().getMessage());
                } finally {
                    timers.stop(timerName);
                }
            }
        } catch (RuntimeException e) {
            transactionManager.rollback(status);
            log.warn("[Worker] 배치 롤백. uniqId: {}, error: {}", uniqId, e.getMessage());
            throw e;
        }

        timers.start(RequestTimers.COMMIT);
        transactionManager.commit(status);
        timers.stop(RequestTimers.COMMIT);

        return new BatchExecutionResult(results, affected, failed);
    }

    private StatementOutcome executeStatement(QueryEntry entry) {
        return jdbcTemplate.execute(
                (PreparedStatementCreator) connection -> connection.prepareStatement(entry.statement()),
                (PreparedStatement ps) -> {
                    new ArgumentPreparedStatementSetter(entry.parameters().toArray()).setValues(ps);

                    // 결과 집합이 있는 문(SELECT)은 affected 에 더하지 않는다
                    if (ps.execute()) {
                        try (ResultSet rs = ps.getResultSet()) {
                            List<Map<String, Object>> rows =
                                    new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
                            return new StatementOutcome(rows, 0);
                        }
                    }
                    return new StatementOutcome(List.of(), Math.max(ps.getUpdateCount(), 0));
                });
    }

    private static void appendRows(
            Map<String, List<Map<String, Object>>> results,
            QueryEntry entry,
            List<Map<String, Object>> rows,
            String uniqId
    ) {
        // affected, timers 는 행을 담지 않는 예약 키
        if (ResultEnvelope.isReservedKey(entry.resultKey())) {
            if (!rows.isEmpty()) {
                log.warn("[Worker] 예약 키로 조회된 행 버림. uniqId: {}, key: {}, rows: {}",
                        uniqId, entry.resultKey(), rows.size());
            }
            return;
        }
        results.computeIfAbsent(entry.resultKey(), key -> new ArrayList<>()).addAll(rows);
    }

    // "<번호> <동사> <crc32> <uniqId>" 예) 100 INSERT 1224460250 srv:9298b7b6
    static String statementTimerName(int number, QueryEntry entry, String uniqId) {
        CRC32 crc32 = new CRC32();
        crc32.update(entry.statement().getBytes(StandardCharsets.UTF_8));
        return String.format(Locale.ROOT, "%d %s %d %s", number, entry.verb(), crc32.getValue(), uniqId);
    }

    private record StatementOutcome(List<Map<String, Object>> rows, int updateCount) {
    }
}
