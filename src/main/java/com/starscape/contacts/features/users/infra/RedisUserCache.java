package com.starscape.contacts.features.users.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.contacts.features.users.app.UserSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Caches {@link UserSnapshot}s as JSON under {@code user:{userId}}.
 * Cache failures are logged and treated as misses; the database stays authoritative.
 */
@Component
public class RedisUserCache {

    private static final Logger log = LoggerFactory.getLogger(RedisUserCache.class);

    private static final String KEY_PREFIX = "user:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisUserCache(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${app.cache.user-ttl}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    public Optional<UserSnapshot> get(String userId) {
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + userId);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, UserSnapshot.class));
        } catch (DataAccessException e) {
            log.warn("User cache read failed for {}", userId, e);
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry for {}", userId, e);
            evict(userId);
            return Optional.empty();
        }
    }

    public void put(UserSnapshot user) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + user.id(), objectMapper.writeValueAsString(user), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("User cache write failed for {}", user.id(), e);
        }
    }

    public void evict(String userId) {
        try {
            redisTemplate.delete(KEY_PREFIX + userId);
        } catch (DataAccessException e) {
            log.warn("User cache eviction failed for {}", userId, e);
        }
    }
}
