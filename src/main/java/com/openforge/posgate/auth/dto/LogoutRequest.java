package com.openforge.posgate.auth.dto;

public record LogoutRequest(String refreshToken) {
}
