package com.termaccess.backend.modules.grant.presentation;

import java.util.List;

import com.termaccess.backend.modules.access.application.AccessHookService;
import com.termaccess.backend.modules.access.presentation.dto.GrantRecordResponse;
import com.termaccess.backend.modules.grant.presentation.dto.RebuildResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/grants")
public class GrantAdminController {

    private final AccessHookService accessHookService;

    public GrantAdminController(AccessHookService accessHookService) {
        this.accessHookService = accessHookService;
    }

    @Operation(summary = "Rebuild grants", description = "Drops and recomputes every grant record of the realm.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rebuild finished"),
            @ApiResponse(responseCode = "403", description = "Admin capability required"),
            @ApiResponse(responseCode = "409", description = "A rebuild is already running")
    })
    @PostMapping("/rebuild")
    public ResponseEntity<RebuildResponse> rebuild() {
        return ResponseEntity.ok(RebuildResponse.from(accessHookService.rebuildGrants()));
    }

    @Operation(summary = "Stored grant records", description = "Grant rows currently stored for one content item, without recomputing them.")
    @GetMapping("/content/{contentItemId}")
    public ResponseEntity<List<GrantRecordResponse>> storedRecords(@PathVariable("contentItemId") long contentItemId) {
        List<GrantRecordResponse> records = accessHookService.storedGrantRecords(contentItemId).stream()
                .map(GrantRecordResponse::from)
                .toList();
        return ResponseEntity.ok(records);
    }
}
