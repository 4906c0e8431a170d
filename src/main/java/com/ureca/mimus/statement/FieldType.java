package com.ureca.mimus.statement;

import lombok.Getter;

import java.math.BigInteger;

/**
 * 스키마에서 사용하는 부호 없는 정수 컬럼 타입
 * 현재 테이블들이 정수만 쓰기 때문에 정수 타입만 둔다
 */
@Getter
public enum FieldType {

    TINYINT(1, BigInteger.valueOf(255L)),                   // uint8
    SMALLINT(2, BigInteger.valueOf(65_535L)),               // uint16
    MEDIUMINT(3, BigInteger.valueOf(16_777_215L)),          // uint24
    INT(4, BigInteger.valueOf(4_294_967_295L)),             // uint32
    BIGINT(8, new BigInteger("18446744073709551615"));      // uint64

    private final int byteWidth;
    private final BigInteger maxValue;

    FieldType(int byteWidth, BigInteger maxValue) {
        this.byteWidth = byteWidth;
        this.maxValue = maxValue;
    }
}
