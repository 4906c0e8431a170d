package com.ureca.mimus.support;

import com.ureca.mimus.config.EnqueueProperties;
import com.ureca.mimus.config.WorkerProperties;
import com.ureca.mimus.worker.BatchExecutionMode;

import java.time.Duration;

/**
 * application.yml 기본값과 같은 설정 객체
 */
public final class TestProperties {

    public static EnqueueProperties enqueue() {
        return new EnqueueProperties(
                "srvA",
                Duration.ofMillis(100),
                2.0,
                Duration.ofMillis(2500),
                Duration.ofSeconds(30),
                Duration.ofSeconds(10));
    }

    public static WorkerProperties worker() {
        return worker(BatchExecutionMode.NON_ATOMIC);
    }

    public static WorkerProperties worker(BatchExecutionMode mode) {
        return new WorkerProperties(
                true,
                Duration.ofSeconds(30),
                Duration.ofSeconds(1),
                Duration.ofMillis(100),
                Duration.ofSeconds(10),
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                mode,
                new WorkerProperties.Bootstrap(
                        Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), Duration.ofSeconds(10)));
    }

    private TestProperties() {
    }
}
