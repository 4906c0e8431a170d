package com.ureca.mimus.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // 큐잉 / 결과 조회
    LOOKUP_TIMEOUT("LOOKUP_TIMEOUT", "제한 시간 내에 트랜잭션 결과를 찾지 못했습니다."),
    MALFORMED_BATCH("MALFORMED_BATCH", "쿼리 배치 메시지를 해석할 수 없습니다."),
    SERIALIZATION_FAILED("SERIALIZATION_FAILED", "트랜잭션 메시지 직렬화에 실패했습니다."),

    // 워커
    BATCH_ROLLED_BACK("BATCH_ROLLED_BACK", "배치 실행 중 무결성 위반으로 전체 롤백되었습니다."),
    DATABASE_CONNECTION_FAILED("DATABASE_CONNECTION_FAILED", "데이터베이스 연결에 실패했습니다.");

    private final String code;
    private final String message;
}
