package com.ureca.mimus.statement.query;

import com.ureca.mimus.statement.StatementBuilder;
import com.ureca.mimus.statement.TableSchemas;
import com.ureca.mimus.transaction.dto.QueryEntry;
import com.ureca.mimus.transaction.dto.ResultEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * card 테이블 쿼리 항목 생성
 */
@Component
@RequiredArgsConstructor
public class CardQueries {

    public static final String CARD_LIST_KEY = "cardlist";

    private final StatementBuilder statementBuilder;

    // 플레이어가 가진 카드 전체
    public List<QueryEntry> getAll(long ownerId) {
        return List.of(QueryEntry.of(
                statementBuilder.select(TableSchemas.CARD, List.of(ownerId), "ownerid"), CARD_LIST_KEY));
    }

    // 드롭/선물 카드 (비용 없음)
    public List<QueryEntry> create(long ownerId, long cardType) {
        return create(ownerId, cardType, null, 0);
    }

    /**
     * @param costField  구매에 쓴 재화 컬럼 (stones, points), null 이면 비용 없음
     * @param costAmount 지불한 양
     */
    public List<QueryEntry> create(long ownerId, long cardType, String costField, long costAmount) {
        Map<String, Object> card = new LinkedHashMap<>();
        card.put("type", cardType);
        card.put("ownerid", ownerId);
        if (costField != null) {
            card.put(costField, costAmount);
        }

        return statementBuilder.insert(TableSchemas.CARD, card)
                .map(statement -> List.of(QueryEntry.of(statement, ResultEnvelope.AFFECTED)))
                .orElse(List.of());
    }
}
