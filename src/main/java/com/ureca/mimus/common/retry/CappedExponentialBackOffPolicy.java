package com.ureca.mimus.common.retry;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;

/**
 * 지수 증가 대기 정책
 * 한 번의 대기는 maxInterval 을 넘지 않고, 마감 시간까지 남은 시간보다 길지도 않다
 * <p>
 * 예) 100ms, x2, 최대 2500ms -> 100, 200, 400, 800, 1600, 2500, 2500 ...
 */
public class CappedExponentialBackOffPolicy implements BackOffPolicy {

    private final long initialInterval;
    private final double multiplier;
    private final long maxInterval;
    private final long deadlineMillis;
    private final Clock clock;
    private final Sleeper sleeper;

    public CappedExponentialBackOffPolicy(RetrySettings settings, Clock clock, Sleeper sleeper) {
        this.initialInterval = settings.initialInterval().toMillis();
        this.multiplier = settings.multiplier();
        this.maxInterval = settings.maxInterval().toMillis();
        this.deadlineMillis = settings.deadline().toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new CappedBackOffContext(context, Math.min(initialInterval, maxInterval));
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        CappedBackOffContext context = (CappedBackOffContext) backOffContext;

        long remaining = DeadlineRetryPolicy.remainingMillis(context.retryContext, clock, deadlineMillis);
        long sleepMillis = Math.min(context.interval, Math.max(remaining, 0));
        if (context.interval >= remaining) {
            // 이 대기는 마감 시각에 끝나므로 마감 시각의 마지막 시도를 허용
            context.retryContext.setAttribute(
                    DeadlineRetryPolicy.FINAL_ATTEMPT_ATTRIBUTE, context.retryContext.getRetryCount());
        }

        try {
            if (sleepMillis > 0) {
                sleeper.sleep(sleepMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("백오프 대기 중 인터럽트", e);
        }

        context.interval = Math.min((long) (context.interval * multiplier), maxInterval);
    }

    private static final class CappedBackOffContext implements BackOffContext {
        private final RetryContext retryContext;
        private long interval;

        private CappedBackOffContext(RetryContext retryContext, long interval) {
            this.retryContext = retryContext;
            this.interval = interval;
        }
    }
}
