package com.ureca.mimus.statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ? 플레이스홀더를 가진 SQL 과 바인딩할 값 목록
 * 값 목록 순서 = 플레이스홀더 순서
 */
public record SqlStatement(String sql, List<Object> parameters) {

    public SqlStatement {
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlStatement of(String sql) {
        return new SqlStatement(sql, List.of());
    }
}
