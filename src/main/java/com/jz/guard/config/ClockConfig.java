package com.jz.guard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/** 全局唯一时间源：窗口计数、封禁过期都以它为准。精度取毫秒，与 DATETIME(3) 一致 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemDefaultZone(), Duration.ofMillis(1));
    }
}
