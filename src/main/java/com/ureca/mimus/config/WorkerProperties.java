package com.ureca.mimus.config;

import com.ureca.mimus.common.retry.RetrySettings;
import com.ureca.mimus.worker.BatchExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 큐 워커 설정
 *
 * @param enabled               이 프로세스에서 워커 루프 실행 여부
 * @param messageTimeout        이보다 오래 큐에 있던 메시지는 실행하지 않는다
 * @param pullWaitWindow        pull 한 번에 메시지를 기다리는 시간
 * @param idleSleep             빈 pull 뒤 쉬는 시간
 * @param noMessageWarnInterval "메시지 없음" 경고 최소 간격
 * @param timerWarnThreshold    타이머 로그를 WARN 으로 올리는 기준
 * @param resultTtl             결과 저장소 TTL
 * @param executionMode         무결성 위반 시 배치 처리 방식
 * @param bootstrap             기동 시 DB 연결/테이블 생성 재시도
 */
@ConfigurationProperties(prefix = "mimus.worker")
public record WorkerProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("30s") Duration messageTimeout,
        @DefaultValue("1s") Duration pullWaitWindow,
        @DefaultValue("100ms") Duration idleSleep,
        @DefaultValue("10s") Duration noMessageWarnInterval,
        @DefaultValue("10s") Duration timerWarnThreshold,
        @DefaultValue("30s") Duration resultTtl,
        @DefaultValue("NON_ATOMIC") BatchExecutionMode executionMode,
        @DefaultValue Bootstrap bootstrap
) {
    public record Bootstrap(
            @DefaultValue("1s") Duration initialInterval,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("10s") Duration maxInterval,
            @DefaultValue("10s") Duration deadline
    ) {
        public RetrySettings toRetrySettings() {
            return new RetrySettings(initialInterval, multiplier, maxInterval, deadline);
        }
    }
}
