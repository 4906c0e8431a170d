package com.ureca.mimus.statement;

/**
 * 스키마에 없는 필드를 어떻게 다룰지
 */
public enum ValidationMode {

    // 스키마에 없는 필드는 검증 없이 그대로 SQL에 포함
    PASS_THROUGH,

    // 스키마에 없는 필드는 제거
    STRICT
}
