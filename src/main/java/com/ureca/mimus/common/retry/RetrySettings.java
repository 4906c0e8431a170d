package com.ureca.mimus.common.retry;

import java.time.Duration;

/**
 * 지수 백오프 + 전체 마감 시간 설정
 *
 * @param initialInterval 첫 번째 대기 시간
 * @param multiplier      재시도마다 대기 시간에 곱해지는 값
 * @param maxInterval     한 번의 대기 시간 상한
 * @param deadline        첫 시도부터 전체 재시도가 끝나야 하는 시간
 */
public record RetrySettings(
        Duration initialInterval,
        double multiplier,
        Duration maxInterval,
        Duration deadline
) {
    public RetrySettings {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier는 1.0 이상이어야 합니다: " + multiplier);
        }
    }
}
