package com.ureca.mimus.worker;

import java.util.List;
import java.util.Map;

/**
 * @param results          결과 키 -> 행 목록 (배치 순서)
 * @param affected         영향받은 행 수 합계
 * @param failedStatements 무결성 위반으로 건너뛴 문 수
 */
public record BatchExecutionResult(
        Map<String, List<Map<String, Object>>> results,
        int affected,
        int failedStatements
) {
}
