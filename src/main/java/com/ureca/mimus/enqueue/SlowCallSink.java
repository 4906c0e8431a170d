package com.ureca.mimus.enqueue;

/**
 * 느린 호출 진단 기록 대상
 */
public interface SlowCallSink {

    void record(String line);
}
