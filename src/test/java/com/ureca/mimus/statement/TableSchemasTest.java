package com.ureca.mimus.statement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TableSchemas 단위 테스트")
class TableSchemasTest {

    @Test
    @DisplayName("등록된 테이블은 이름으로 찾는다")
    void find_RegisteredTable() {
        assertThat(TableSchemas.find("player")).contains(TableSchemas.PLAYER);
        assertThat(TableSchemas.find("card")).contains(TableSchemas.CARD);
        assertThat(TableSchemas.find("guild")).isEmpty();
    }

    @Test
    @DisplayName("all 은 등록 순서 유지")
    void all_KeepsRegistrationOrder() {
        assertThat(TableSchemas.all())
                .extracting(TableSchema::name)
                .containsExactly("player", "card");
    }

    @Test
    @DisplayName("card 스키마 필드 타입")
    void card_FieldTypes() {
        TableSchema card = TableSchemas.CARD;

        assertThat(card.primaryKey()).isEqualTo("id");
        assertThat(card.typeOf("stones")).isEqualTo(FieldType.TINYINT);
        assertThat(card.typeOf("type")).isEqualTo(FieldType.MEDIUMINT);
        assertThat(card.indexedFields()).containsExactly("ownerid");
    }

    @Test
    @DisplayName("스키마는 생성 후 변경 불가")
    void schema_IsImmutable() {
        assertThatThrownBy(() -> TableSchemas.PLAYER.fields().put("level", FieldType.INT))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("필드 목록에 없는 기본 키는 거부")
    void schema_RejectsUnknownPrimaryKey() {
        assertThatThrownBy(() -> new TableSchema("broken", "id", Map.of("slots", FieldType.INT), Set.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("기본 키");
    }
}
