package com.termaccess.backend.modules.access.application;

/**
 * Notified when an access check denies a content item.
 */
public interface AccessDeniedObserver {

    void onAccessDenied(long contentItemId);
}
