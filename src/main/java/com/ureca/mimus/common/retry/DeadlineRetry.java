package com.ureca.mimus.common.retry;

import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 마감 시간 기반 재시도 RetryTemplate 생성
 * <p>
 * 실패 가능한 어떤 작업이든 감쌀 수 있는 재사용 조합기
 * - 한 번의 대기 상한 (maxInterval)
 * - 전체 마감 시간 (deadline)
 * - 백오프 배수 (multiplier)
 * <p>
 * nonRetryable 로 지정한 예외는 재시도 없이 즉시 종료
 */
public final class DeadlineRetry {

    public static RetryTemplate template(
            RetrySettings settings,
            Clock clock,
            List<Class<? extends Throwable>> nonRetryable
    ) {
        return template(settings, clock, new ThreadWaitSleeper(), nonRetryable);
    }

    public static RetryTemplate template(
            RetrySettings settings,
            Clock clock,
            Sleeper sleeper,
            List<Class<? extends Throwable>> nonRetryable
    ) {
        // 예외가 키로 해서 Map으로 매핑, 나머지는 재시도
        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        nonRetryable.forEach(type -> retryableExceptions.put(type, false));
        BinaryExceptionClassifier classifier = new BinaryExceptionClassifier(retryableExceptions, true);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(
                new DeadlineRetryPolicy(settings.deadline().toMillis(), clock, classifier));
        retryTemplate.setBackOffPolicy(
                new CappedExponentialBackOffPolicy(settings, clock, sleeper));
        return retryTemplate;
    }

    private DeadlineRetry() {
        // 인스턴스화 방지
    }
}
