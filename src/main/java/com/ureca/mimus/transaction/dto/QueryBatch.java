package com.ureca.mimus.transaction.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 한 트랜잭션으로 실행할 SQL 문 목록
 * 순서가 곧 실행 순서, 결과 집계 순서
 * <p>
 * 와이어 형식: {"queries": [[statement, resultKey], ...]}
 */
public record QueryBatch(List<QueryEntry> queries) {

    public QueryBatch {
        Objects.requireNonNull(queries, "queries");
        queries = Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public static QueryBatch of(List<QueryEntry> queries) {
        return new QueryBatch(queries);
    }
}
