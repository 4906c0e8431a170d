package com.ureca.mimus.config;

import com.ureca.mimus.common.retry.RetrySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 프로듀서 측 결과 폴링 설정
 *
 * @param serverId          기본 srv_id
 * @param initialInterval   첫 폴링 대기
 * @param multiplier        대기 증가 배수
 * @param maxInterval       한 번의 대기 상한
 * @param deadline          첫 폴링부터의 전체 마감 시간
 * @param slowCallThreshold 이 시간을 넘긴 발행/왕복은 slow-call 로 기록
 */
@ConfigurationProperties(prefix = "mimus.enqueue")
public record EnqueueProperties(
        @DefaultValue("srv-local") String serverId,
        @DefaultValue("100ms") Duration initialInterval,
        @DefaultValue("2.0") double multiplier,
        @DefaultValue("2500ms") Duration maxInterval,
        @DefaultValue("30s") Duration deadline,
        @DefaultValue("10s") Duration slowCallThreshold
) {
    public RetrySettings toRetrySettings() {
        return new RetrySettings(initialInterval, multiplier, maxInterval, deadline);
    }
}
