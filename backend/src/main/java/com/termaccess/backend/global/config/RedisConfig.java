package com.termaccess.backend.global.config;

import com.termaccess.backend.modules.invalidation.application.CacheTagInvalidator;
import com.termaccess.backend.modules.invalidation.infrastructure.RedisCacheTagInvalidator;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Routes cache tag invalidations through Redis pub/sub when
 * {@code app.invalidation.redis.enabled=true}; otherwise tags are only logged.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.invalidation.redis.enabled", havingValue = "true")
public class RedisConfig {

    @Bean
    public CacheTagInvalidator redisCacheTagInvalidator(
            StringRedisTemplate stringRedisTemplate,
            @Value("${app.invalidation.redis.channel:term-access.cache-tags}") String channel
    ) {
        return new RedisCacheTagInvalidator(stringRedisTemplate, channel);
    }
}
