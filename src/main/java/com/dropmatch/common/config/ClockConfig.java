package com.dropmatch.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 전이 로그, 멱등성 기록, 감사 이벤트의 시각은 모두 이 Clock에서 나온다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
