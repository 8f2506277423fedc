package com.termaccess.backend.global.config;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunables of the term access layer, read from {@code app.access.*}.
 */
@Component
public class AccessControlSettings {

    private final boolean inheritHierarchy;
    private final int maxHierarchyDepth;
    private final Set<String> restrictedVocabularies;
    private final boolean nodeAccessRecordsDisabled;
    private final String bypassCapability;
    private final String adminCapability;

    public AccessControlSettings(
            @Value("${app.access.inherit-hierarchy:false}") boolean inheritHierarchy,
            @Value("${app.access.max-hierarchy-depth:50}") int maxHierarchyDepth,
            @Value("${app.access.restricted-vocabularies:}") List<String> restrictedVocabularies,
            @Value("${app.access.disable-node-access-records:false}") boolean nodeAccessRecordsDisabled,
            @Value("${app.access.bypass-capability:bypass node access}") String bypassCapability,
            @Value("${app.access.admin-capability:administer permissions by term}") String adminCapability
    ) {
        if (maxHierarchyDepth < 1) {
            throw new IllegalArgumentException("app.access.max-hierarchy-depth must be >= 1");
        }
        this.inheritHierarchy = inheritHierarchy;
        this.maxHierarchyDepth = maxHierarchyDepth;
        this.restrictedVocabularies = restrictedVocabularies == null ? Set.of() : restrictedVocabularies.stream()
                .map(String::trim)
                .filter(vocabulary -> !vocabulary.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.nodeAccessRecordsDisabled = nodeAccessRecordsDisabled;
        this.bypassCapability = bypassCapability;
        this.adminCapability = adminCapability;
    }

    public boolean inheritHierarchy() {
        return inheritHierarchy;
    }

    public int maxHierarchyDepth() {
        return maxHierarchyDepth;
    }

    /**
     * Empty means every vocabulary participates in restriction.
     */
    public Set<String> restrictedVocabularies() {
        return restrictedVocabularies;
    }

    public boolean participates(String vocabulary) {
        return restrictedVocabularies.isEmpty() || restrictedVocabularies.contains(vocabulary);
    }

    public boolean nodeAccessRecordsDisabled() {
        return nodeAccessRecordsDisabled;
    }

    public String bypassCapability() {
        return bypassCapability;
    }

    public String adminCapability() {
        return adminCapability;
    }
}
