package com.ureca.mimus.enqueue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * mimus.slowcall 로거로 기록
 * logback-spring.xml 에서 별도 롤링 파일(logs/slow-call.log)로 분리
 */
@Slf4j(topic = "mimus.slowcall")
@Component
public class LoggingSlowCallSink implements SlowCallSink {

    @Override
    public void record(String line) {
        log.warn(line);
    }
}
