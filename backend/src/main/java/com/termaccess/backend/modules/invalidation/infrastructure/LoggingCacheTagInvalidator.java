package com.termaccess.backend.modules.invalidation.infrastructure;

import com.termaccess.backend.modules.invalidation.application.CacheTagInvalidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default sink when no Redis channel is configured. The host polls nothing; tags are only logged.
 */
@Component
@ConditionalOnProperty(value = "app.invalidation.redis.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingCacheTagInvalidator implements CacheTagInvalidator {

    private static final Logger log = LoggerFactory.getLogger(LoggingCacheTagInvalidator.class);

    @Override
    public void invalidate(String tag) {
        log.info("Cache tag invalidated: {}", tag);
    }
}
