package com.starscape.contacts.common.ratelimit;

import com.starscape.contacts.common.config.RateLimitProperties;
import com.starscape.contacts.common.exception.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fixed-window request counter kept in Redis.
 * One script increments the counter and gives it an expiry whenever it has none, so a
 * window always ends even if an earlier call was interrupted. Redis outages fail open.
 */
@Component
public class RedisRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);

    private static final String KEY_PREFIX = "rate:";

    // Returns {count, remaining window in millis}
    @SuppressWarnings("rawtypes")
    static final RedisScript<List> COUNT_IN_WINDOW = RedisScript.of(
            "local count = redis.call('INCR', KEYS[1]) "
                + "local ttl = redis.call('PTTL', KEYS[1]) "
                + "if ttl < 0 then "
                + "redis.call('PEXPIRE', KEYS[1], ARGV[1]) "
                + "ttl = tonumber(ARGV[1]) "
                + "end "
                + "return {count, ttl}",
            List.class);

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimiter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Count one request of {@code subject} against the named bucket.
     *
     * @throws RateLimitExceededException when the window's allowance is used up
     */
    public void acquire(String bucket, String subject, RateLimitProperties.Limit limit) {
        if (!limit.isEnabled()) {
            return;
        }

        String key = KEY_PREFIX + bucket + ":" + subject;
        List<?> result;
        try {
            result = redisTemplate.execute(COUNT_IN_WINDOW, List.of(key),
                String.valueOf(limit.getWindow().toMillis()));
        } catch (DataAccessException e) {
            log.warn("Rate limiter unavailable, allowing request: bucket={}, subject={}", bucket, subject, e);
            return;
        }
        if (result == null || result.size() < 2) {
            log.warn("Unexpected rate limiter reply, allowing request: bucket={}, subject={}", bucket, subject);
            return;
        }

        long count = ((Number) result.get(0)).longValue();
        if (count > limit.getMaxRequests()) {
            long ttlMillis = ((Number) result.get(1)).longValue();
            long retryAfter = Math.max(1, (ttlMillis + 999) / 1000);
            log.debug("Rate limit exceeded: bucket={}, subject={}, count={}", bucket, subject, count);
            throw new RateLimitExceededException(
                "No more than " + limit.getMaxRequests() + " request(s) per "
                    + limit.getWindow().toSeconds() + " seconds",
                retryAfter);
        }
    }
}
