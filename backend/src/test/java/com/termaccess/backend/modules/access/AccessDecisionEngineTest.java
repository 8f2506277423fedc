package com.termaccess.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.termaccess.backend.global.config.AccessControlSettings;
import com.termaccess.backend.modules.access.application.AccessDecisionEngine;
import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.content.application.ContentItemQuery;
import com.termaccess.backend.modules.permission.application.TermPermissionStore;
import com.termaccess.backend.modules.permission.domain.TermAccessList;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyException;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyResolver;
import com.termaccess.backend.support.AccessSettingsFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessDecisionEngineTest {

    private static final long EDITOR_USER_ID = 101L;

    @Mock
    private TermPermissionStore termPermissionStore;

    @Mock
    private TermHierarchyResolver termHierarchyResolver;

    @Mock
    private ContentItemQuery contentItemQuery;

    private AccessPrincipal editor;

    @BeforeEach
    void setUp() {
        editor = new AccessPrincipal(EDITOR_USER_ID, Set.of("editor"), Set.of());
        lenient().when(termPermissionStore.getAccessList(anyLong()))
                .thenAnswer(invocation -> open(invocation.<Long>getArgument(0)));
    }

    private AccessDecisionEngine engine(AccessControlSettings settings) {
        return new AccessDecisionEngine(termPermissionStore, termHierarchyResolver, contentItemQuery, settings);
    }

    @Test
    @DisplayName("content without terms is open to every principal")
    void contentWithoutTermsIsAllowed() {
        when(contentItemQuery.getTermIdsForContentItem(5L)).thenReturn(Set.of());

        assertThat(engine(AccessSettingsFixtures.defaults()).isAllowed(5L, AccessPrincipal.anonymous())).isTrue();
        verify(termPermissionStore, never()).getAccessList(anyLong());
    }

    @Test
    @DisplayName("role allowed on term 7 grants access to content item 10")
    void roleAllowOnSingleTerm() {
        restrict(7L, Set.of(), Set.of("editor"));
        when(contentItemQuery.getTermIdsForContentItem(10L)).thenReturn(Set.of(7L));

        assertThat(engine(AccessSettingsFixtures.defaults()).isAllowed(10L, editor)).isTrue();
    }

    @Test
    @DisplayName("one denying term among several denies the whole item")
    void mostRestrictiveTermWins() {
        restrict(7L, Set.of(), Set.of("editor"));
        restrict(8L, Set.of(500L), Set.of("reviewer"));
        when(contentItemQuery.getTermIdsForContentItem(11L)).thenReturn(Set.of(7L, 8L));

        assertThat(engine(AccessSettingsFixtures.defaults()).isAllowed(11L, editor)).isFalse();
    }

    @Test
    @DisplayName("unrestricted terms do not narrow access next to an allowing term")
    void unrestrictedTermsAreNeutral() {
        restrict(7L, Set.of(EDITOR_USER_ID), Set.of());
        when(contentItemQuery.getTermIdsForContentItem(12L)).thenReturn(Set.of(3L, 7L));

        AccessDecisionEngine engine = engine(AccessSettingsFixtures.defaults());

        assertThat(engine.isAllowed(12L, editor)).isTrue();
        assertThat(engine.isAllowed(12L, AccessPrincipal.anonymous())).isFalse();
    }

    @Test
    @DisplayName("isAllowed equals the conjunction of per-term decisions")
    void isAllowedIsConjunction() {
        restrict(1L, Set.of(EDITOR_USER_ID), Set.of());
        restrict(2L, Set.of(), Set.of("editor"));
        restrict(3L, Set.of(), Set.of("admin"));
        AccessDecisionEngine engine = engine(AccessSettingsFixtures.defaults());

        for (Set<Long> terms : List.of(Set.of(1L), Set.of(1L, 2L), Set.of(2L, 3L), Set.of(1L, 2L, 3L))) {
            when(contentItemQuery.getTermIdsForContentItem(20L)).thenReturn(terms);
            boolean expected = terms.stream().allMatch(termId -> engine.isTermAllowed(termId, editor));
            assertThat(engine.isAllowed(20L, editor)).as("terms %s", terms).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("without inheritance an allow on the parent does not reach the child")
    void inheritanceDisabledIgnoresAncestors() {
        restrict(30L, Set.of(), Set.of("staff"));

        assertThat(engine(AccessSettingsFixtures.defaults()).isTermAllowed(30L, editor)).isFalse();
        verify(termHierarchyResolver, never()).getAncestors(anyLong());
    }

    @Test
    @DisplayName("with inheritance an explicit allow on an ancestor grants access")
    void inheritanceEnabledUsesAncestors() {
        restrict(30L, Set.of(), Set.of("staff"));
        restrict(20L, Set.of(), Set.of("editor"));
        when(termHierarchyResolver.getAncestors(30L)).thenReturn(List.of(25L, 20L));

        assertThat(engine(AccessSettingsFixtures.withInheritance(50)).isTermAllowed(30L, editor)).isTrue();
    }

    @Test
    @DisplayName("an unrestricted ancestor does not open a restricted child")
    void unrestrictedAncestorDoesNotAllow() {
        restrict(30L, Set.of(), Set.of("staff"));
        when(termHierarchyResolver.getAncestors(30L)).thenReturn(List.of(25L));

        assertThat(engine(AccessSettingsFixtures.withInheritance(50)).isTermAllowed(30L, editor)).isFalse();
    }

    @Test
    @DisplayName("a broken hierarchy falls back to no inheritance and denies")
    void hierarchyErrorDenies() {
        restrict(30L, Set.of(), Set.of("staff"));
        when(termHierarchyResolver.getAncestors(30L)).thenThrow(new TermHierarchyException(30L, "cycle"));

        assertThat(engine(AccessSettingsFixtures.withInheritance(50)).isTermAllowed(30L, editor)).isFalse();
    }

    @Test
    @DisplayName("terms of non-participating vocabularies are ignored")
    void nonParticipatingVocabularyIsIgnored() {
        restrict(7L, Set.of(), Set.of("editor"));
        restrict(9L, Set.of(500L), Set.of());
        when(contentItemQuery.getTermIdsForContentItem(13L)).thenReturn(Set.of(7L, 9L));
        when(termHierarchyResolver.vocabulariesOf(Set.of(7L, 9L))).thenReturn(Map.of(7L, "sections", 9L, "tags"));

        AccessDecisionEngine engine = engine(AccessSettingsFixtures.restrictedTo("sections"));

        assertThat(engine.restrictedTermsOf(13L)).containsExactly(7L);
        assertThat(engine.isAllowed(13L, editor)).isTrue();
    }

    @Test
    @DisplayName("filterAllowedTerms keeps open and allowed terms in id order")
    void filterAllowedTerms() {
        restrict(4L, Set.of(), Set.of("editor"));
        restrict(6L, Set.of(500L), Set.of());

        Set<Long> allowed = engine(AccessSettingsFixtures.defaults()).filterAllowedTerms(List.of(6L, 5L, 4L), editor);

        assertThat(allowed).containsExactly(4L, 5L);
    }

    private void restrict(long termId, Set<Long> userIds, Set<String> roleIds) {
        lenient().when(termPermissionStore.getAccessList(termId)).thenReturn(new TermAccessList(termId, userIds, roleIds));
    }

    private static TermAccessList open(long termId) {
        return new TermAccessList(termId, Set.of(), Set.of());
    }
}
