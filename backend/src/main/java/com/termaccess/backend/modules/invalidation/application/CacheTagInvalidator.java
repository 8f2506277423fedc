package com.termaccess.backend.modules.invalidation.application;

/**
 * Host cache / search index invalidation sink.
 */
public interface CacheTagInvalidator {

    void invalidate(String tag);
}
