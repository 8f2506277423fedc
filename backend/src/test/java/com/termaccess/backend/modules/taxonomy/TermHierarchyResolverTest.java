package com.termaccess.backend.modules.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import com.termaccess.backend.modules.taxonomy.application.TermHierarchyException;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyResolver;
import com.termaccess.backend.modules.taxonomy.application.TermNotFoundException;
import com.termaccess.backend.modules.taxonomy.infrastructure.persistence.TaxonomyTermRepository;
import com.termaccess.backend.support.AccessSettingsFixtures;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TermHierarchyResolverTest {

    @Mock
    private TaxonomyTermRepository taxonomyTermRepository;

    @Test
    @DisplayName("inheritance disabled: no ancestors and no tree reads")
    void disabledReturnsEmpty() {
        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.defaults());

        assertThat(resolver.getAncestors(30L)).isEmpty();
        assertThat(resolver.getDescendants(30L)).isEmpty();
        verify(taxonomyTermRepository, never()).findParentIds(anyLong());
    }

    @Test
    @DisplayName("a chain is reported parent first")
    void chainIsParentFirst() {
        when(taxonomyTermRepository.findParentIds(30L)).thenReturn(List.of(20L));
        when(taxonomyTermRepository.findParentIds(20L)).thenReturn(List.of(10L));
        when(taxonomyTermRepository.findParentIds(10L)).thenReturn(List.of());

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.withInheritance(50));

        assertThat(resolver.getAncestors(30L)).containsExactly(20L, 10L);
    }

    @Test
    @DisplayName("an ancestor shared by two parents is reported once")
    void sharedAncestorReportedOnce() {
        when(taxonomyTermRepository.findParentIds(30L)).thenReturn(List.of(20L, 25L));
        when(taxonomyTermRepository.findParentIds(20L)).thenReturn(List.of(10L));
        when(taxonomyTermRepository.findParentIds(25L)).thenReturn(List.of(10L));
        when(taxonomyTermRepository.findParentIds(10L)).thenReturn(List.of());

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.withInheritance(50));

        assertThat(resolver.getAncestors(30L)).containsExactly(20L, 10L, 25L);
    }

    @Test
    @DisplayName("a root term has no ancestors")
    void rootHasNoAncestors() {
        when(taxonomyTermRepository.findParentIds(1L)).thenReturn(List.of());

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.withInheritance(50));

        assertThat(resolver.getAncestors(1L)).isEmpty();
    }

    @Test
    @DisplayName("a cycle raises a hierarchy error")
    void cycleIsDetected() {
        when(taxonomyTermRepository.findParentIds(1L)).thenReturn(List.of(2L));
        when(taxonomyTermRepository.findParentIds(2L)).thenReturn(List.of(1L));

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.withInheritance(50));

        assertThatThrownBy(() -> resolver.getAncestors(1L))
                .isInstanceOf(TermHierarchyException.class)
                .hasMessageContaining("Cycle");
    }

    @Test
    @DisplayName("trees deeper than the configured limit raise a hierarchy error")
    void depthLimitIsEnforced() {
        when(taxonomyTermRepository.findParentIds(4L)).thenReturn(List.of(3L));
        when(taxonomyTermRepository.findParentIds(3L)).thenReturn(List.of(2L));
        when(taxonomyTermRepository.findParentIds(2L)).thenReturn(List.of(1L));

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.withInheritance(2));

        assertThatThrownBy(() -> resolver.getAncestors(4L))
                .isInstanceOfSatisfying(TermHierarchyException.class,
                        ex -> assertThat(ex.getTermId()).isEqualTo(4L));
    }

    @Test
    @DisplayName("descendants follow child edges")
    void descendants() {
        when(taxonomyTermRepository.findChildIds(10L)).thenReturn(List.of(20L, 25L));
        when(taxonomyTermRepository.findChildIds(20L)).thenReturn(List.of(30L));
        when(taxonomyTermRepository.findChildIds(25L)).thenReturn(List.of());
        when(taxonomyTermRepository.findChildIds(30L)).thenReturn(List.of());

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.withInheritance(50));

        assertThat(resolver.getDescendants(10L)).containsExactly(20L, 30L, 25L);
    }

    @Test
    @DisplayName("name lookup returns the lowest matching id")
    void resolveIdByName() {
        when(taxonomyTermRepository.findIdsByNameIgnoreCase("Finance")).thenReturn(List.of(4L, 12L));

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.defaults());

        assertThat(resolver.resolveIdByName(" Finance ")).isEqualTo(4L);
    }

    @Test
    @DisplayName("unknown or blank names are not found")
    void resolveIdByNameNotFound() {
        when(taxonomyTermRepository.findIdsByNameIgnoreCase("nope")).thenReturn(List.of());

        TermHierarchyResolver resolver = new TermHierarchyResolver(taxonomyTermRepository, AccessSettingsFixtures.defaults());

        assertThatThrownBy(() -> resolver.resolveIdByName("nope")).isInstanceOf(TermNotFoundException.class);
        assertThatThrownBy(() -> resolver.resolveIdByName("  ")).isInstanceOf(TermNotFoundException.class);
    }
}
