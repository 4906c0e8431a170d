package com.ureca.mimus.worker;

/**
 * 배치 안에서 무결성 위반이 났을 때의 처리 방식
 */
public enum BatchExecutionMode {

    // 해당 문만 건너뛰고 나머지는 커밋
    NON_ATOMIC,

    // 배치 전체 롤백
    ATOMIC
}
