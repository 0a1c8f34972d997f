package com.openforge.posgate.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Email + password. {@code tenantId} disambiguates an email registered in
 * several shops; without it the first account whose password matches wins.
 */
public record LoginRequest(
        @NotBlank
        @Size(max = 255)
        String email,

        @NotBlank
        @Size(max = 72)
        String password,

        String tenantId
) {
}
