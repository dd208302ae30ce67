package com.creditdesk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the {@code redis} snapshot backend.
 *
 * The snapshot is already serialized to JSON by the store, so both keys and
 * values go through the String serializer: what is stored is exactly the
 * payload the store produced, readable with redis-cli.
 */
@Configuration
@ConditionalOnProperty(prefix = "banque.store", name = "backend", havingValue = "redis")
@Slf4j
public class RedisConfig {

    @Bean
    public RedisTemplate<String, String> snapshotRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setValueSerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate for snapshot payloads");
        return template;
    }
}
