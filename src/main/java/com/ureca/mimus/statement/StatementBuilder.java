package com.ureca.mimus.statement;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * 스키마 기반 SQL 문 생성기
 * <p>
 * 값은 모두 ? 로 바인딩하고, 숫자 필드는 컬럼 타입 범위 [0, max] 로 보정한다
 * 호출자가 넘긴 값의 문제는 예외 없이 보정 또는 "실행할 문 없음"으로 흡수
 * <p>
 * 스키마에 없는 필드:
 * - PASS_THROUGH : 검증 없이 그대로 포함
 * - STRICT : 제거
 */
@Slf4j
@Getter
public class StatementBuilder {

    private static final String ROW_FORMAT = "ROW_FORMAT=COMPRESSED KEY_BLOCK_SIZE=8";

    private final ValidationMode validationMode;

    public StatementBuilder(ValidationMode validationMode) {
        this.validationMode = validationMode;
    }

    /**
     * 기본 키를 제외한 스키마 필드 값을 [0, max] 범위로 보정
     * 넘겨받은 Map 은 변경하지 않고 보정된 복사본을 돌려준다
     *
     * @param table 테이블 스키마
     * @param data  필드 -> 값
     * @return 보정된 필드 -> 값 (입력 순서 유지)
     */
    public Map<String, Object> validate(TableSchema table, Map<String, ?> data) {
        Map<String, Object> validated = new LinkedHashMap<>();
        if (data == null) {
            return validated;
        }

        data.forEach((field, value) -> {
            if (!table.hasField(field)) {
                if (validationMode == ValidationMode.STRICT) {
                    log.warn("[Statement] 스키마에 없는 필드 제거. table: {}, field: {}", table.name(), field);
                    return;
                }
                validated.put(field, value);
                return;
            }

            if (field.equals(table.primaryKey())) {
                validated.put(field, value);
                return;
            }

            validated.put(field, clamp(table, field, value));
        });

        return validated;
    }

    /**
     * INSERT INTO table (f1,f2) VALUES (?,?)
     *
     * @return 보정 후 데이터가 비어 있으면 empty (실행할 문 없음)
     */
    public Optional<SqlStatement> insert(TableSchema table, Map<String, ?> data) {
        log.debug("[Statement] INSERT 준비. table: {}, data: {}", table.name(), data);

        Map<String, Object> validated = validate(table, data);
        if (validated.isEmpty()) {
            return Optional.empty();
        }

        StringJoiner columns = new StringJoiner(",");
        StringJoiner placeholders = new StringJoiner(",");
        List<Object> parameters = new ArrayList<>();

        validated.forEach((field, value) -> {
            columns.add(field);
            placeholders.add("?");
            parameters.add(value);
        });

        SqlStatement statement = new SqlStatement(
                "INSERT INTO " + table.name() + " (" + columns + ") VALUES (" + placeholders + ")",
                parameters);
        log.debug("[Statement] {}", statement.sql());
        return Optional.of(statement);
    }

    public SqlStatement select(TableSchema table, Collection<?> values) {
        return select(table, values, null);
    }

    /**
     * SELECT * FROM table [WHERE field IN (?,...)]
     *
     * @param values 비어 있거나 null 이면 조건 없이 전체 조회
     * @param field  null 이면 기본 키
     */
    public SqlStatement select(TableSchema table, Collection<?> values, String field) {
        String column = (field == null || field.isBlank()) ? table.primaryKey() : field;

        if (values == null || values.isEmpty()) {
            SqlStatement statement = SqlStatement.of("SELECT * FROM " + table.name());
            log.debug("[Statement] {}", statement.sql());
            return statement;
        }

        StringJoiner placeholders = new StringJoiner(",");
        values.forEach(value -> placeholders.add("?"));

        SqlStatement statement = new SqlStatement(
                "SELECT * FROM " + table.name() + " WHERE " + column + " IN (" + placeholders + ")",
                new ArrayList<>(values));
        log.debug("[Statement] {}", statement.sql());
        return statement;
    }

    /**
     * UPDATE table SET k1=?,k2=? WHERE pk=?
     *
     * @return 보정 후 데이터가 비어 있으면 empty (실행할 문 없음)
     */
    public Optional<SqlStatement> update(TableSchema table, Object primaryKeyValue, Map<String, ?> data) {
        log.debug("[Statement] UPDATE 준비. table: {}, pkey: {}", table.name(), primaryKeyValue);

        Map<String, Object> validated = validate(table, data);
        if (validated.isEmpty()) {
            return Optional.empty();
        }

        StringJoiner assignments = new StringJoiner(",");
        List<Object> parameters = new ArrayList<>();

        validated.forEach((field, value) -> {
            assignments.add(field + "=?");
            parameters.add(value);
        });
        parameters.add(primaryKeyValue);

        SqlStatement statement = new SqlStatement(
                "UPDATE " + table.name() + " SET " + assignments + " WHERE " + table.primaryKey() + "=?",
                parameters);
        log.debug("[Statement] {}", statement.sql());
        return Optional.of(statement);
    }

    /**
     * CREATE TABLE IF NOT EXISTS
     * 모든 컬럼은 UNSIGNED NOT NULL, 기본 키는 AUTO_INCREMENT UNIQUE, 나머지는 DEFAULT 0
     */
    public String createTable(TableSchema table) {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
                .append(table.name())
                .append(" (");

        table.fields().forEach((field, type) -> {
            sql.append(field).append(' ').append(type.name()).append(" UNSIGNED NOT NULL");
            if (field.equals(table.primaryKey())) {
                sql.append(" AUTO_INCREMENT UNIQUE");
            } else {
                sql.append(" DEFAULT 0");
            }
            sql.append(", ");
        });

        for (String indexed : table.indexedFields()) {
            sql.append("INDEX ").append(indexed).append("_idx (").append(indexed).append("), ");
        }

        sql.append("PRIMARY KEY(").append(table.primaryKey()).append(")) ").append(ROW_FORMAT);

        String createSql = sql.toString();
        log.debug("[Statement] {}", createSql);
        return createSql;
    }

    private Object clamp(TableSchema table, String field, Object value) {
        FieldType type = table.typeOf(field);

        BigInteger number;
        try {
            number = toBigInteger(value);
        } catch (NumberFormatException | ArithmeticException e) {
            log.error("[Statement] 숫자가 아닌 값. 0으로 보정. table: {}, field: '{}', value: '{}', type: {}",
                    table.name(), field, value, type);
            return 0L;
        }

        if (number.signum() < 0) {
            // 언더플로우는 최소값
            return 0L;
        }

        if (number.compareTo(type.getMaxValue()) > 0) {
            log.error("[Statement] 허용 범위 초과. 최대값으로 보정. field: '{}', value: '{}', type: {}, range: [0,{}]",
                    field, value, type, type.getMaxValue());
            // 오버플로우는 최대값
            return toParameter(type.getMaxValue());
        }

        return toParameter(number);
    }

    private static BigInteger toBigInteger(Object value) {
        if (value == null) {
            throw new NumberFormatException("null");
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger;
        }
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal.toBigInteger();
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).toBigInteger();
        }
        if (value instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        return new BigDecimal(value.toString().trim()).toBigInteger();
    }

    // long 범위면 Long, 아니면 BigInteger (BIGINT UNSIGNED 상위 구간)
    private static Object toParameter(BigInteger number) {
        return number.bitLength() < Long.SIZE ? (Object) number.longValue() : number;
    }
}
