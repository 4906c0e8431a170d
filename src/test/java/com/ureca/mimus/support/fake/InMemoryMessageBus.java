package com.ureca.mimus.support.fake;

import com.ureca.mimus.bus.MessageBus;
import com.ureca.mimus.bus.PulledMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 단일 프로세스 안에서 프로듀서/워커를 잇는 MessageBus
 * ack 되지 않은 메시지는 unacknowledged() 로 확인
 */
public class InMemoryMessageBus implements MessageBus {

    private final LinkedBlockingQueue<PulledMessage> queue = new LinkedBlockingQueue<>();
    private final Map<String, PulledMessage> inFlight = new ConcurrentHashMap<>();
    private final Set<String> acknowledged = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final long waitMillis;

    public InMemoryMessageBus(long waitMillis) {
        this.waitMillis = waitMillis;
    }

    @Override
    public void publish(String body, Map<String, String> attributes) {
        queue.add(new PulledMessage(String.valueOf(sequence.incrementAndGet()), body, attributes));
    }

    @Override
    public List<PulledMessage> pull(int maxMessages) {
        List<PulledMessage> pulled = new ArrayList<>();
        try {
            PulledMessage first = queue.poll(waitMillis, TimeUnit.MILLISECONDS);
            if (first == null) {
                return pulled;
            }
            pulled.add(first);
            queue.drainTo(pulled, maxMessages - 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pulled.forEach(message -> inFlight.put(message.ackId(), message));
        return pulled;
    }

    @Override
    public void acknowledge(List<String> ackIds) {
        ackIds.forEach(ackId -> {
            inFlight.remove(ackId);
            acknowledged.add(ackId);
        });
    }

    public Set<String> acknowledged() {
        return acknowledged;
    }

    public int unacknowledged() {
        return inFlight.size() + queue.size();
    }
}
