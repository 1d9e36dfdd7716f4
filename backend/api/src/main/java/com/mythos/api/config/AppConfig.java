package com.mythos.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * 시간 의존 로직(rate limit 윈도우, 타임스탬프)이 공유하는 시계
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
