package com.ureca.mimus.bus;

import java.util.Map;

/**
 * 버스에서 꺼낸 메시지 하나
 *
 * @param ackId      acknowledge 에 넘길 식별자
 * @param body       메시지 본문 (JSON)
 * @param attributes 메시지 속성 (srv_id, trans_id, insertion_time)
 */
public record PulledMessage(String ackId, String body, Map<String, String> attributes) {

    public PulledMessage {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
