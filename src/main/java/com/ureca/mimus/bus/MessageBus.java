package com.ureca.mimus.bus;

import java.util.List;
import java.util.Map;

/**
 * 발행/구독 메시지 버스 계약
 * 전달 보장은 at-least-once, 재전달과 워커 간 분배는 버스가 담당
 */
public interface MessageBus {

    void publish(String body, Map<String, String> attributes);

    /**
     * 최대 maxMessages 개를 꺼낸다
     * 버스의 대기 시간 안에 메시지가 없으면 빈 목록
     */
    List<PulledMessage> pull(int maxMessages);

    // ack 된 메시지는 재전달 대상에서 빠진다
    void acknowledge(List<String> ackIds);
}
