package com.ureca.mimus.statement;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 테이블 이름 -> 스키마 정적 레지스트리
 * 기동 시 한 번 만들어지고 이후 변경되지 않음
 */
public final class TableSchemas {

    public static final TableSchema PLAYER = TableSchema.builder("player")
            .primaryKey("id", FieldType.INT)
            .field("slots", FieldType.SMALLINT)
            .field("points", FieldType.SMALLINT)
            .field("stones", FieldType.SMALLINT)
            .field("stamina", FieldType.SMALLINT)
            .build();

    public static final TableSchema CARD = TableSchema.builder("card")
            .primaryKey("id", FieldType.INT)
            .indexedField("ownerid", FieldType.INT)
            .field("type", FieldType.MEDIUMINT)
            .field("stones", FieldType.TINYINT)
            .field("points", FieldType.TINYINT)
            .field("evolves", FieldType.INT)
            .field("levels", FieldType.INT)
            .field("xp01", FieldType.MEDIUMINT)
            .field("xp02", FieldType.MEDIUMINT)
            .build();

    private static final Map<String, TableSchema> REGISTRY = register(PLAYER, CARD);

    public static Optional<TableSchema> find(String tableName) {
        return Optional.ofNullable(REGISTRY.get(tableName));
    }

    public static Collection<TableSchema> all() {
        return REGISTRY.values();
    }

    private static Map<String, TableSchema> register(TableSchema... schemas) {
        Map<String, TableSchema> registry = new LinkedHashMap<>();
        for (TableSchema schema : List.of(schemas)) {
            if (registry.putIfAbsent(schema.name(), schema) != null) {
                throw new IllegalStateException("중복된 테이블 이름: " + schema.name());
            }
        }
        return Collections.unmodifiableMap(registry);
    }

    private TableSchemas() {
        // 인스턴스화 방지
    }
}
