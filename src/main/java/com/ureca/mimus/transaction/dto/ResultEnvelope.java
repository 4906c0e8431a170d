package com.ureca.mimus.transaction.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 배치 하나의 실행 결과
 * <p>
 * JSON: {resultKey: [row, ...], ..., "affected": n, "timers": {name: seconds}}
 * affected, timers 는 예약 키로 행 목록을 담지 않는다
 */
public class ResultEnvelope {

    public static final String AFFECTED = "affected";
    public static final String TIMERS = "timers";

    private final Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
    private int affected;
    private final SortedMap<String, Double> timers = new TreeMap<>();

    public ResultEnvelope() {
    }

    public static ResultEnvelope of(
            Map<String, List<Map<String, Object>>> results,
            int affected,
            Map<String, Double> timers
    ) {
        ResultEnvelope envelope = new ResultEnvelope();
        results.forEach(envelope::putResult);
        envelope.setAffected(affected);
        envelope.setTimers(timers);
        return envelope;
    }

    public static boolean isReservedKey(String key) {
        return AFFECTED.equals(key) || TIMERS.equals(key);
    }

    @JsonAnyGetter
    public Map<String, List<Map<String, Object>>> getResults() {
        return results;
    }

    @JsonAnySetter
    public void putResult(String resultKey, List<Map<String, Object>> rows) {
        if (isReservedKey(resultKey)) {
            throw new IllegalArgumentException("예약된 결과 키: " + resultKey);
        }
        results.put(resultKey, new ArrayList<>(rows));
    }

    public List<Map<String, Object>> rows(String resultKey) {
        return results.getOrDefault(resultKey, List.of());
    }

    @JsonProperty(AFFECTED)
    public int getAffected() {
        return affected;
    }

    @JsonProperty(AFFECTED)
    public void setAffected(int affected) {
        this.affected = affected;
    }

    @JsonProperty(TIMERS)
    public SortedMap<String, Double> getTimers() {
        return timers;
    }

    @JsonProperty(TIMERS)
    public void setTimers(Map<String, Double> timers) {
        this.timers.clear();
        if (timers != null) {
            this.timers.putAll(timers);
        }
    }
}
