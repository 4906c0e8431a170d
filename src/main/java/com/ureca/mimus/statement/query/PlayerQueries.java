package com.ureca.mimus.statement.query;

import com.ureca.mimus.statement.StatementBuilder;
import com.ureca.mimus.statement.TableSchemas;
import com.ureca.mimus.transaction.dto.QueryEntry;
import com.ureca.mimus.transaction.dto.ResultEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * player 테이블 쿼리 항목 생성
 * 반환값은 배치에 그대로 넣을 수 있는 (statement, resultKey) 목록
 */
@Component
@RequiredArgsConstructor
public class PlayerQueries {

    public static final String PLAYER_KEY = "player";

    private final StatementBuilder statementBuilder;

    // 플레이어 이름 -> id (CRC32, 충돌 가능)
    public static long nameToId(String name) {
        CRC32 crc32 = new CRC32();
        crc32.update(name.getBytes(StandardCharsets.UTF_8));
        return crc32.getValue();
    }

    public List<QueryEntry> get(long playerId) {
        return List.of(QueryEntry.of(
                statementBuilder.select(TableSchemas.PLAYER, List.of(playerId)), PLAYER_KEY));
    }

    /**
     * @param loadout 초기 지급 값 (slots, points, stones, stamina ...)
     */
    public List<QueryEntry> create(long playerId, Map<String, ?> loadout) {
        Map<String, Object> player = new LinkedHashMap<>();
        player.put(TableSchemas.PLAYER.primaryKey(), playerId);
        player.putAll(loadout);

        return statementBuilder.insert(TableSchemas.PLAYER, player)
                .map(statement -> List.of(QueryEntry.of(statement, ResultEnvelope.AFFECTED)))
                .orElse(List.of());
    }

    // player 에 id 가 들어 있어야 한다
    public List<QueryEntry> update(Map<String, ?> player) {
        Object playerId = player.get(TableSchemas.PLAYER.primaryKey());
        if (playerId == null) {
            throw new IllegalArgumentException("player id 누락: " + player);
        }

        return statementBuilder.update(TableSchemas.PLAYER, playerId, player)
                .map(statement -> List.of(QueryEntry.of(statement, ResultEnvelope.AFFECTED)))
                .orElse(List.of());
    }
}
