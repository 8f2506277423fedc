package com.termaccess.backend.modules.permission.presentation.dto;

import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Full replacement of a term's allowed principals. Two empty sets lift every restriction.
 */
public record UpdateTermPermissionsRequest(
        @NotNull Set<@NotNull @Positive Long> userIds,
        @NotNull Set<@NotBlank String> roleIds
) {
}
