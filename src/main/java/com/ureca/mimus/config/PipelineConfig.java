package com.ureca.mimus.config;

import com.ureca.mimus.statement.StatementBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class PipelineConfig {

    // 시간을 읽는 곳은 모두 이 Clock 사용 (테스트에서 교체)
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StatementBuilder statementBuilder(StatementProperties properties) {
        log.info("[Statement] 검증 모드: {}", properties.validationMode());
        return new StatementBuilder(properties.validationMode());
    }
}
