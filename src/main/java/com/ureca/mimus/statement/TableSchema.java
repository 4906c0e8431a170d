package com.ureca.mimus.statement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 논리 테이블 하나의 스키마
 * 필드 순서는 선언 순서 그대로 유지 (CREATE TABLE 컬럼 순서)
 * 생성 후 변경 불가
 */
public record TableSchema(
        String name,
        String primaryKey,
        Map<String, FieldType> fields,
        Set<String> indexedFields
) {
    public TableSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(primaryKey, "primaryKey");
        if (!fields.containsKey(primaryKey)) {
            throw new IllegalArgumentException(
                    "기본 키가 필드 목록에 없습니다. table: " + name + ", primaryKey: " + primaryKey);
        }
        for (String indexed : indexedFields) {
            if (!fields.containsKey(indexed)) {
                throw new IllegalArgumentException(
                        "인덱스 필드가 필드 목록에 없습니다. table: " + name + ", field: " + indexed);
            }
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        indexedFields = Collections.unmodifiableSet(new LinkedHashSet<>(indexedFields));
    }

    public FieldType typeOf(String field) {
        return fields.get(field);
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String primaryKey;
        private final Map<String, FieldType> fields = new LinkedHashMap<>();
        private final Set<String> indexedFields = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder primaryKey(String primaryKey, FieldType type) {
            this.primaryKey = primaryKey;
            this.fields.put(primaryKey, type);
            return this;
        }

        public Builder field(String field, FieldType type) {
            this.fields.put(field, type);
            return this;
        }

        public Builder indexedField(String field, FieldType type) {
            this.fields.put(field, type);
            this.indexedFields.add(field);
            return this;
        }

        public TableSchema build() {
            return new TableSchema(name, primaryKey, fields, indexedFields);
        }
    }
}
