package com.termaccess.backend.modules.permission.presentation;

import com.termaccess.backend.modules.access.application.AccessHookService;
import com.termaccess.backend.modules.permission.domain.PermissionChangeSet;
import com.termaccess.backend.modules.permission.presentation.dto.PermissionChangeResponse;
import com.termaccess.backend.modules.permission.presentation.dto.TermLookupResponse;
import com.termaccess.backend.modules.permission.presentation.dto.TermPermissionsResponse;
import com.termaccess.backend.modules.permission.presentation.dto.UpdateTermPermissionsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/terms")
public class TermPermissionAdminController {

    private final AccessHookService accessHookService;

    public TermPermissionAdminController(AccessHookService accessHookService) {
        this.accessHookService = accessHookService;
    }

    @Operation(summary = "Term permissions", description = "Users and roles currently allowed on the term.")
    @GetMapping("/{termId}/permissions")
    public ResponseEntity<TermPermissionsResponse> getPermissions(@PathVariable("termId") long termId) {
        return ResponseEntity.ok(TermPermissionsResponse.from(accessHookService.termPermissions(termId)));
    }

    @Operation(summary = "Replace term permissions", description = "Term form submit: stores exactly the submitted users and roles and recomputes affected grants.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Saved; the response lists what changed"),
            @ApiResponse(responseCode = "403", description = "Admin capability required"),
            @ApiResponse(responseCode = "422", description = "Unknown user or role")
    })
    @PutMapping("/{termId}/permissions")
    public ResponseEntity<PermissionChangeResponse> replacePermissions(
            @PathVariable("termId") long termId,
            @Valid @RequestBody UpdateTermPermissionsRequest request
    ) {
        PermissionChangeSet changeSet = accessHookService.onTermFormSubmit(termId, request.userIds(), request.roleIds());
        return ResponseEntity.ok(PermissionChangeResponse.from(changeSet));
    }

    @Operation(summary = "Term lookup by name", description = "Case-insensitive; the lowest id wins when several terms share a name.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Term found"),
            @ApiResponse(responseCode = "404", description = "No term with that name")
    })
    @GetMapping("/lookup")
    public ResponseEntity<TermLookupResponse> lookup(@RequestParam("name") String name) {
        return ResponseEntity.ok(new TermLookupResponse(name, accessHookService.lookupTerm(name)));
    }
}
