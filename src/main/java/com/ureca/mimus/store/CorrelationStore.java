package com.ureca.mimus.store;

import java.time.Duration;
import java.util.Optional;

/**
 * 워커 -> 프로듀서 결과 전달용 임시 키/값 저장소 계약
 * 한 번 쓰고 여러 번 읽는다, TTL 이 지나면 없는 것과 같다
 */
public interface CorrelationStore {

    Optional<String> get(String key);

    void setWithTtl(String key, String value, Duration ttl);
}
