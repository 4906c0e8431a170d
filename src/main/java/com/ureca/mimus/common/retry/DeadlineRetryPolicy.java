package com.ureca.mimus.common.retry;

import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

import java.time.Clock;

/**
 * 첫 시도 시점부터 마감 시간까지만 재시도하는 정책
 * 시도 횟수 제한은 없음, 시간만 본다
 * 마지막 대기가 마감 시각에 끝나면 그 시각에 한 번 더 시도하고, 그 뒤로는 시도하지 않는다
 * <p>
 * 시작 시각은 RetryContext 속성으로 저장해서
 * {@link CappedExponentialBackOffPolicy} 가 남은 시간을 계산할 때 함께 사용
 */
public class DeadlineRetryPolicy implements RetryPolicy {

    static final String START_MILLIS_ATTRIBUTE = "mimus.retry.start-millis";
    // 마감 시각까지 대기한 뒤 허용되는 마지막 시도 (그때의 retryCount)
    static final String FINAL_ATTEMPT_ATTRIBUTE = "mimus.retry.final-attempt";

    private final long deadlineMillis;
    private final Clock clock;
    private final BinaryExceptionClassifier retryableClassifier;

    public DeadlineRetryPolicy(long deadlineMillis, Clock clock, BinaryExceptionClassifier retryableClassifier) {
        this.deadlineMillis = deadlineMillis;
        this.clock = clock;
        this.retryableClassifier = retryableClassifier;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable lastThrowable = context.getLastThrowable();
        boolean retryable = lastThrowable == null || retryableClassifier.classify(lastThrowable);
        if (!retryable) {
            return false;
        }
        if (remainingMillis(context, clock, deadlineMillis) > 0) {
            return true;
        }
        // 마감 이후에는 마감 시각에 맞춘 대기 직후의 한 번만
        Object finalAttempt = context.getAttribute(FINAL_ATTEMPT_ATTRIBUTE);
        return finalAttempt instanceof Integer retryCount && retryCount == context.getRetryCount();
    }

    @Override
    public RetryContext open(RetryContext parent) {
        RetryContextSupport context = new RetryContextSupport(parent);
        context.setAttribute(START_MILLIS_ATTRIBUTE, clock.millis());
        return context;
    }

    @Override
    public void close(RetryContext context) {
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
    }

    static long remainingMillis(RetryContext context, Clock clock, long deadlineMillis) {
        Object start = context.getAttribute(START_MILLIS_ATTRIBUTE);
        if (!(start instanceof Long startMillis)) {
            return deadlineMillis;
        }
        return deadlineMillis - (clock.millis() - startMillis);
    }
}
