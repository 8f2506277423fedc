package com.termaccess.backend.modules.invalidation.infrastructure;

import com.termaccess.backend.modules.invalidation.application.CacheTagInvalidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Publishes each tag on a Redis channel the host's cache and search workers subscribe to.
 */
public class RedisCacheTagInvalidator implements CacheTagInvalidator {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheTagInvalidator.class);

    private final StringRedisTemplate redisTemplate;
    private final String channel;

    public RedisCacheTagInvalidator(StringRedisTemplate redisTemplate, String channel) {
        this.redisTemplate = redisTemplate;
        this.channel = channel;
    }

    @Override
    public void invalidate(String tag) {
        Long receivers = redisTemplate.convertAndSend(channel, tag);
        log.debug("Published {} to {} ({} receivers)", tag, channel, receivers);
    }
}
