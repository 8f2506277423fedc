package com.termaccess.backend.modules.taxonomy.domain;

public interface TermVocabularyView {

    Long getId();

    String getVocabularyId();
}
