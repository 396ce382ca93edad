package com.campushub.backend.global.common.time;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 서비스와 JPA 감사(auditing)가 함께 쓰는 UTC 시계.
 * 신청 시각({@code registered_at})을 포함한 모든 시각은 이 빈에서 얻는다.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
