package com.termaccess.backend.modules.content.domain;

import java.util.HashSet;
import java.util.Set;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Host content item (node) with its taxonomy references across all reference fields.
 */
@Entity
@Immutable
@Table(name = "content_item")
public class ContentItem {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "published", nullable = false)
    private boolean published;

    @Column(name = "langcode", length = 12)
    private String langcode;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "content_item_term", joinColumns = @JoinColumn(name = "content_item_id"))
    private Set<TermReference> termReferences = new HashSet<>();

    protected ContentItem() {
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public boolean isPublished() {
        return published;
    }

    public String getLangcode() {
        return langcode;
    }

    public Set<TermReference> getTermReferences() {
        return termReferences;
    }
}
