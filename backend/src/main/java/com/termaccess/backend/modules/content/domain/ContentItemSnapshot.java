package com.termaccess.backend.modules.content.domain;

import java.util.Set;

/**
 * Access-relevant state of a content item at the time it was read.
 */
public record ContentItemSnapshot(long id, boolean published, String language, Set<Long> termIds) {

    public static final String UNDEFINED_LANGUAGE = "und";

    public ContentItemSnapshot {
        language = (language == null || language.isBlank()) ? UNDEFINED_LANGUAGE : language;
        termIds = Set.copyOf(termIds);
    }
}
