package com.ureca.mimus.transaction.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.ureca.mimus.statement.SqlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 배치 안의 SQL 문 하나와 결과를 담을 키
 * <p>
 * 와이어 형식: [statement, resultKey] 또는 [statement, resultKey, [param, ...]]
 */
@JsonSerialize(using = QueryEntryJsonSerializer.class)
@JsonDeserialize(using = QueryEntryJsonDeserializer.class)
public record QueryEntry(String statement, String resultKey, List<Object> parameters) {

    public QueryEntry {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(resultKey, "resultKey");
        parameters = parameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static QueryEntry of(String statement, String resultKey) {
        return new QueryEntry(statement, resultKey, List.of());
    }

    public static QueryEntry of(SqlStatement statement, String resultKey) {
        return new QueryEntry(statement.sql(), resultKey, statement.parameters());
    }

    // 첫 단어 (INSERT, SELECT ...) - 타이머 이름용
    public String verb() {
        String trimmed = statement.strip();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
