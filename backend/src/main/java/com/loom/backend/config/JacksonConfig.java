package com.loom.backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP 응답과 SQLite payload 컬럼이 같은 ObjectMapper를 쓴다.
 * Boot 기본 mapper 위에 필요한 것만 덧붙인다.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer loomJackson() {
        return builder -> builder
                // presence/lock/event의 Instant
                .modulesToInstall(new JavaTimeModule())
                // 2026-01-05T... 형태 (숫자 timestamp 방지)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // client가 envelope 필드를 더 붙여 보내도 요청은 통과
                .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
