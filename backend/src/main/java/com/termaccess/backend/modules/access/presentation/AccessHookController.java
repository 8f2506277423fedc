package com.termaccess.backend.modules.access.presentation;

import java.util.List;

import com.termaccess.backend.global.error.ProblemException;
import com.termaccess.backend.global.security.SecurityUtils;
import com.termaccess.backend.modules.access.application.AccessHookService;
import com.termaccess.backend.modules.access.domain.AccessDecision;
import com.termaccess.backend.modules.access.domain.AccessOperation;
import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.access.presentation.dto.AccessCheckResponse;
import com.termaccess.backend.modules.access.presentation.dto.GrantRecordResponse;
import com.termaccess.backend.modules.access.presentation.dto.GrantsResponse;
import com.termaccess.backend.modules.access.presentation.dto.PermittedTermsResponse;
import com.termaccess.backend.modules.grant.domain.GrantRecord;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/hooks")
public class AccessHookController {

    private final AccessHookService accessHookService;

    public AccessHookController(AccessHookService accessHookService) {
        this.accessHookService = accessHookService;
    }

    @Operation(summary = "Single-item access check", description = "Decides view/update/delete access of the current principal to one content item.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision taken"),
            @ApiResponse(responseCode = "400", description = "Unknown operation"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    @GetMapping("/content/{contentItemId}/access")
    public ResponseEntity<AccessCheckResponse> checkAccess(
            @PathVariable("contentItemId") long contentItemId,
            @RequestParam(name = "operation", required = false) String operationParam
    ) {
        AccessOperation operation = parseOperation(operationParam);
        AccessDecision decision = accessHookService.onAccessCheck(contentItemId, operation, SecurityUtils.currentPrincipal());
        return ResponseEntity.ok(new AccessCheckResponse(contentItemId, operation, decision));
    }

    @Operation(summary = "Grant memberships", description = "Gids the current principal belongs to, for joining against node access grants.")
    @GetMapping("/grants")
    public ResponseEntity<GrantsResponse> grants(@RequestParam(name = "operation", required = false) String operationParam) {
        AccessOperation operation = parseOperation(operationParam);
        List<Integer> gids = accessHookService.onGrantsRequested(SecurityUtils.currentPrincipal(), operation);
        return ResponseEntity.ok(new GrantsResponse(GrantRecord.REALM, operation, gids));
    }

    @Operation(summary = "Grant records of a content item", description = "Recomputes, stores and returns the grant records of one content item.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Records returned (empty when node access records are disabled)"),
            @ApiResponse(responseCode = "404", description = "Unknown content item")
    })
    @GetMapping("/content/{contentItemId}/grant-records")
    public ResponseEntity<List<GrantRecordResponse>> grantRecords(@PathVariable("contentItemId") long contentItemId) {
        return ResponseEntity.ok(toResponses(accessHookService.onGrantRecordsRequested(contentItemId)));
    }

    @Operation(summary = "Content item saved", description = "Host notification after a content item insert or update.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grants recomputed"),
            @ApiResponse(responseCode = "404", description = "Unknown content item")
    })
    @PostMapping("/content/{contentItemId}/saved")
    public ResponseEntity<List<GrantRecordResponse>> contentSaved(@PathVariable("contentItemId") long contentItemId) {
        return ResponseEntity.ok(toResponses(accessHookService.onContentItemSaved(contentItemId)));
    }

    @Operation(summary = "Permitted terms", description = "Restricted terms (or terms of one vocabulary) the current principal is allowed on.")
    @GetMapping("/terms/permitted")
    public ResponseEntity<PermittedTermsResponse> permittedTerms(
            @RequestParam(name = "vocabulary", required = false) String vocabulary
    ) {
        AccessPrincipal principal = SecurityUtils.currentPrincipal();
        List<Long> termIds = List.copyOf(accessHookService.permittedTerms(principal, vocabulary));
        return ResponseEntity.ok(new PermittedTermsResponse(vocabulary, termIds));
    }

    private AccessOperation parseOperation(String value) {
        try {
            return AccessOperation.from(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_operation",
                    "Unsupported operation: " + value);
        }
    }

    private List<GrantRecordResponse> toResponses(List<GrantRecord> records) {
        return records.stream()
                .map(GrantRecordResponse::from)
                .toList();
    }
}
