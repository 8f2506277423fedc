package com.termaccess.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.termaccess.backend.global.config.AccessControlSettings;
import com.termaccess.backend.global.error.RetryableProblemException;
import com.termaccess.backend.modules.access.application.AccessDecisionEngine;
import com.termaccess.backend.modules.access.application.AccessDeniedObserver;
import com.termaccess.backend.modules.access.application.AccessHookService;
import com.termaccess.backend.modules.access.domain.AccessDecision;
import com.termaccess.backend.modules.access.domain.AccessOperation;
import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.audit.application.AuditLogService;
import com.termaccess.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.termaccess.backend.modules.content.application.ContentItemNotFoundException;
import com.termaccess.backend.modules.content.application.ContentItemQuery;
import com.termaccess.backend.modules.grant.application.GrantIndexMaintainer;
import com.termaccess.backend.modules.grant.domain.GrantRecord;
import com.termaccess.backend.modules.grant.domain.RebuildReport;
import com.termaccess.backend.modules.invalidation.application.InvalidationSignaler;
import com.termaccess.backend.modules.permission.application.TermPermissionStore;
import com.termaccess.backend.modules.permission.domain.PermissionChangeSet;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyResolver;
import com.termaccess.backend.support.AccessSettingsFixtures;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AccessHookServiceTest {

    private static final AccessPrincipal EDITOR = new AccessPrincipal(101L, Set.of("editor"), Set.of());
    private static final AccessPrincipal BYPASS = new AccessPrincipal(1L, Set.of("administrator"),
            Set.of(AccessSettingsFixtures.BYPASS));

    @Mock
    private AccessDecisionEngine accessDecisionEngine;

    @Mock
    private GrantIndexMaintainer grantIndexMaintainer;

    @Mock
    private TermPermissionStore termPermissionStore;

    @Mock
    private TermHierarchyResolver termHierarchyResolver;

    @Mock
    private ContentItemQuery contentItemQuery;

    @Mock
    private InvalidationSignaler invalidationSignaler;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private AccessDeniedObserver accessDeniedObserver;

    private AccessHookService service() {
        return service(AccessSettingsFixtures.defaults());
    }

    private AccessHookService service(AccessControlSettings settings) {
        return new AccessHookService(
                accessDecisionEngine,
                grantIndexMaintainer,
                termPermissionStore,
                termHierarchyResolver,
                contentItemQuery,
                invalidationSignaler,
                auditLogService,
                List.of(accessDeniedObserver),
                settings
        );
    }

    @Test
    @DisplayName("unpublished content item 42 without terms is denied and reported")
    void unpublishedContentIsDenied() {
        when(contentItemQuery.isPublished(42L)).thenReturn(false);

        AccessDecision decision = service().onAccessCheck(42L, AccessOperation.VIEW, EDITOR);

        assertThat(decision).isEqualTo(AccessDecision.DENY);
        verify(accessDeniedObserver).onAccessDenied(42L);
        verify(accessDecisionEngine, never()).isAllowed(anyLong(), any());
    }

    @Test
    @DisplayName("bypass capability allows before anything is read")
    void bypassAllows() {
        AccessDecision decision = service().onAccessCheck(42L, AccessOperation.DELETE, BYPASS);

        assertThat(decision).isEqualTo(AccessDecision.ALLOW);
        verifyNoInteractions(contentItemQuery, accessDecisionEngine, accessDeniedObserver);
    }

    @Test
    @DisplayName("published content follows the term decision")
    void publishedContentUsesEngine() {
        when(contentItemQuery.isPublished(10L)).thenReturn(true);
        when(accessDecisionEngine.isAllowed(10L, EDITOR)).thenReturn(true);
        when(contentItemQuery.isPublished(11L)).thenReturn(true);
        when(accessDecisionEngine.isAllowed(11L, EDITOR)).thenReturn(false);

        AccessHookService service = service();

        assertThat(service.onAccessCheck(10L, AccessOperation.VIEW, EDITOR)).isEqualTo(AccessDecision.ALLOW);
        assertThat(service.onAccessCheck(11L, AccessOperation.UPDATE, EDITOR)).isEqualTo(AccessDecision.DENY);
        verify(accessDeniedObserver, never()).onAccessDenied(anyLong());
    }

    @Test
    @DisplayName("an internal failure while deciding denies")
    void internalFailureDenies() {
        when(contentItemQuery.isPublished(10L)).thenReturn(true);
        when(accessDecisionEngine.isAllowed(10L, EDITOR)).thenThrow(new IllegalStateException("db down"));

        assertThat(service().onAccessCheck(10L, AccessOperation.VIEW, EDITOR)).isEqualTo(AccessDecision.DENY);
    }

    @Test
    @DisplayName("an unknown content item denies")
    void unknownContentDenies() {
        when(contentItemQuery.isPublished(99L)).thenThrow(new ContentItemNotFoundException(99L));

        assertThat(service().onAccessCheck(99L, AccessOperation.VIEW, EDITOR)).isEqualTo(AccessDecision.DENY);
    }

    @Test
    @DisplayName("a failing observer does not change the denial")
    void failingObserverKeepsDenial() {
        when(contentItemQuery.isPublished(42L)).thenReturn(false);
        doThrow(new IllegalStateException("audit down")).when(accessDeniedObserver).onAccessDenied(42L);

        assertThat(service().onAccessCheck(42L, AccessOperation.VIEW, EDITOR)).isEqualTo(AccessDecision.DENY);
    }

    @Test
    @DisplayName("grant memberships come from the maintainer; bypass gets every gid")
    void grantsRequested() {
        when(grantIndexMaintainer.membershipGids(EDITOR)).thenReturn(List.of(1, 2));
        when(grantIndexMaintainer.allGids()).thenReturn(List.of(1, 2, 3));

        AccessHookService service = service();

        assertThat(service.onGrantsRequested(EDITOR, AccessOperation.VIEW)).containsExactly(1, 2);
        assertThat(service.onGrantsRequested(BYPASS, AccessOperation.VIEW)).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("grant records are empty when node access records are disabled")
    void grantRecordsDisabled() {
        when(grantIndexMaintainer.recordGrantsForContentItem(10L)).thenReturn(Optional.empty());

        assertThat(service(AccessSettingsFixtures.nodeAccessRecordsDisabled()).onGrantRecordsRequested(10L)).isEmpty();
    }

    @Test
    @DisplayName("an unchanged term form submit skips recomputation and invalidation")
    void unchangedSubmitDoesNothing() {
        when(termPermissionStore.saveTermPermissions(7L, Set.of(1L), Set.of("editor")))
                .thenReturn(PermissionChangeSet.unchanged(7L));

        PermissionChangeSet changeSet = service().onTermFormSubmit(7L, Set.of(1L), Set.of("editor"));

        assertThat(changeSet.isEmpty()).isTrue();
        verifyNoInteractions(grantIndexMaintainer, invalidationSignaler, auditLogService);
        verify(contentItemQuery, never()).contentItemIdsReferencing(anyCollection());
    }

    @Test
    @DisplayName("a changed term form submit recomputes referencing content and invalidates it")
    void changedSubmitRecomputes() {
        PermissionChangeSet changes = new PermissionChangeSet(7L, Set.of(2L), Set.of(), Set.of(), Set.of("editor"));
        when(termPermissionStore.saveTermPermissions(7L, Set.of(1L, 2L), Set.of())).thenReturn(changes);
        when(contentItemQuery.contentItemIdsReferencing(Set.of(7L))).thenReturn(List.of(10L, 11L));

        service().onTermFormSubmit(7L, Set.of(1L, 2L), Set.of());

        verify(grantIndexMaintainer).recordGrantsForContentItem(10L);
        verify(grantIndexMaintainer).recordGrantsForContentItem(11L);
        verify(grantIndexMaintainer).pruneUnusedPolicies();
        verify(invalidationSignaler).contentVisibilityChanged(List.of(10L, 11L), Set.of(7L));

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo(AuditLogService.ACTION_TERM_PERMISSIONS_UPDATED);
        assertThat(captor.getValue().resourceKey()).isEqualTo("7");
    }

    @Test
    @DisplayName("with inheritance, content under descendant terms is recomputed too")
    void changedSubmitIncludesDescendants() {
        PermissionChangeSet changes = new PermissionChangeSet(7L, Set.of(2L), Set.of(), Set.of(), Set.of());
        when(termPermissionStore.saveTermPermissions(7L, Set.of(2L), Set.of())).thenReturn(changes);
        when(termHierarchyResolver.getDescendants(7L)).thenReturn(List.of(17L));
        when(contentItemQuery.contentItemIdsReferencing(Set.of(7L, 17L))).thenReturn(List.of(30L));

        service(AccessSettingsFixtures.withInheritance(50)).onTermFormSubmit(7L, Set.of(2L), Set.of());

        verify(grantIndexMaintainer).recordGrantsForContentItem(30L);
        verify(invalidationSignaler).contentVisibilityChanged(List.of(30L), Set.of(7L, 17L));
    }

    @Test
    @DisplayName("cancelling a user removes their records and recomputes the affected terms")
    void userCancelled() {
        when(termPermissionStore.deleteAllForUser(55L)).thenReturn(Set.of(7L, 9L));
        when(contentItemQuery.contentItemIdsReferencing(Set.of(7L, 9L))).thenReturn(List.of(10L));

        Set<Long> affected = service().onUserCancelled(55L);

        assertThat(affected).containsExactlyInAnyOrder(7L, 9L);
        verify(grantIndexMaintainer).recordGrantsForContentItem(10L);
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo(AuditLogService.ACTION_USER_PERMISSIONS_DELETED);
    }

    @Test
    @DisplayName("cancelling a user without records touches nothing else")
    void userCancelledWithoutRecords() {
        when(termPermissionStore.deleteAllForUser(55L)).thenReturn(Set.of());

        assertThat(service().onUserCancelled(55L)).isEmpty();
        verifyNoInteractions(grantIndexMaintainer, invalidationSignaler, auditLogService);
    }

    @Test
    @DisplayName("a rebuild started while another runs is rejected as retryable")
    void overlappingRebuildIsRejected() {
        AccessHookService service = service();
        RebuildReport report = new RebuildReport(2, 1, 1, OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        when(grantIndexMaintainer.rebuildAll()).thenAnswer(invocation -> {
            assertThatThrownBy(service::rebuildGrants)
                    .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                        assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.CONFLICT);
                        assertThat(ex.getRetryAfterSeconds()).isPositive();
                    });
            return report;
        });

        assertThat(service.rebuildGrants()).isEqualTo(report);
        verify(invalidationSignaler).signal(anyCollection());
    }

    @Test
    @DisplayName("a failed rebuild releases the guard")
    void failedRebuildReleasesGuard() {
        AccessHookService service = service();
        RebuildReport report = new RebuildReport(0, 0, 0, OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        when(grantIndexMaintainer.rebuildAll())
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(report);

        assertThatThrownBy(service::rebuildGrants).isInstanceOf(IllegalStateException.class);
        assertThat(service.rebuildGrants()).isEqualTo(report);
    }

    @Test
    @DisplayName("permitted terms are filtered by the engine")
    void permittedTerms() {
        when(termHierarchyResolver.termIdsInVocabulary("sections")).thenReturn(List.of(4L, 5L, 6L));
        when(accessDecisionEngine.filterAllowedTerms(List.of(4L, 5L, 6L), EDITOR)).thenReturn(Set.of(4L, 5L));

        assertThat(service().permittedTerms(EDITOR, "sections")).containsExactlyInAnyOrder(4L, 5L);
    }

    @Test
    @DisplayName("stored grant records are read without recomputation")
    void storedGrantRecords() {
        GrantRecord record = new GrantRecord(10L, GrantRecord.REALM, 2, true, true, true, "en", true);
        when(grantIndexMaintainer.grantRecordsFor(10L)).thenReturn(List.of(record));

        assertThat(service().storedGrantRecords(10L)).containsExactly(record);
        verify(grantIndexMaintainer, never()).recordGrantsForContentItem(anyLong());
    }
}
