package com.creditdesk.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * JSON and time configuration shared by the store, its backends and the exporter.
 *
 * SNAPSHOT FORMAT:
 * ================
 * - Instants are written as ISO-8601 strings, not epoch numbers
 * - Null fields are omitted: an absent field in a partial update means "keep"
 * - Unknown fields are ignored so that an older build can read a newer payload
 */
@Configuration
@Slf4j
public class JacksonConfig {

    @Bean
    public ObjectMapper snapshotObjectMapper() {
        ObjectMapper mapper = createSnapshotMapper();
        log.info("Configured snapshot ObjectMapper with JavaTimeModule and NON_NULL inclusion");
        return mapper;
    }

    /**
     * Every timestamp the application stamps comes from this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    public static ObjectMapper createSnapshotMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }
}
