package com.creditdesk.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Backend keeping the payload as a plain Redis string under the snapshot key.
 * No expiration: a snapshot lives until the store clears it.
 */
@Component
@ConditionalOnProperty(prefix = "banque.store", name = "backend", havingValue = "redis")
@Slf4j
public class RedisSnapshotBackend implements SnapshotBackend {

    private final RedisTemplate<String, String> redisTemplate;

    public RedisSnapshotBackend(@Qualifier("snapshotRedisTemplate") RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> load(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Redis error loading snapshot " + key, e);
        }
    }

    @Override
    public void save(String key, String payload) {
        try {
            redisTemplate.opsForValue().set(key, payload);
            log.debug("Saved snapshot {} to Redis", key);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Redis error saving snapshot " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Redis error deleting snapshot " + key, e);
        }
    }
}
