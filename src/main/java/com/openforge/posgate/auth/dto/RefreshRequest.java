package com.openforge.posgate.auth.dto;

/** A missing token is reported as REFRESH_TOKEN_REQUIRED, not as a validation error. */
public record RefreshRequest(String refreshToken) {
}
