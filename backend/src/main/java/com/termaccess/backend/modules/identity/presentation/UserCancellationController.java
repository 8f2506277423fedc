package com.termaccess.backend.modules.identity.presentation;

import java.util.Set;

import com.termaccess.backend.modules.access.application.AccessHookService;
import com.termaccess.backend.modules.identity.presentation.dto.UserCancellationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class UserCancellationController {

    private final AccessHookService accessHookService;

    public UserCancellationController(AccessHookService accessHookService) {
        this.accessHookService = accessHookService;
    }

    @Operation(summary = "User cancelled", description = "Removes every term permission that names the user.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Records removed"),
            @ApiResponse(responseCode = "403", description = "Admin capability required")
    })
    @PostMapping("/{userId}/cancel")
    public ResponseEntity<UserCancellationResponse> cancel(@PathVariable("userId") long userId) {
        Set<Long> affectedTerms = accessHookService.onUserCancelled(userId);
        return ResponseEntity.ok(new UserCancellationResponse(userId, affectedTerms.stream().sorted().toList()));
    }
}
