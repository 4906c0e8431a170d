package com.ureca.mimus.support.fake;

import com.ureca.mimus.store.CorrelationStore;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

// TTL 은 기록만 하고 만료시키지 않는다
public class InMemoryCorrelationStore implements CorrelationStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        values.put(key, value);
        ttls.put(key, ttl);
    }

    public Duration ttlOf(String key) {
        return ttls.get(key);
    }

    public Map<String, String> values() {
        return values;
    }
}
