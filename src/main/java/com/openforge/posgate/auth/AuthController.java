package com.openforge.posgate.auth;

import com.openforge.posgate.auth.dto.AuthResponse;
import com.openforge.posgate.auth.dto.CreateTenantRequest;
import com.openforge.posgate.auth.dto.LoginRequest;
import com.openforge.posgate.auth.dto.LogoutRequest;
import com.openforge.posgate.auth.dto.MeResponse;
import com.openforge.posgate.auth.dto.RefreshRequest;
import com.openforge.posgate.auth.dto.SetupRequest;
import com.openforge.posgate.auth.dto.TenantCreatedResponse;
import com.openforge.posgate.auth.dto.UserSummary;
import com.openforge.posgate.common.ApiResponse;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.rbac.TenantRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Base path: /api/auth
 *
 * login / refresh / setup are public; the rest require a bearer token.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService         authService;
    private final LoginRateLimiter    loginRateLimiter;
    private final AuthorizationEngine authorizationEngine;

    @PostMapping("/login")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        String clientIp = request.getRemoteAddr();
        loginRateLimiter.acquire(clientIp);
        return ApiResponse.ok(authService.login(req, clientIp));
    }

    @PostMapping("/refresh")
    public ApiResponse<AuthResponse> refresh(@RequestBody(required = false) RefreshRequest req,
                                             HttpServletRequest request) {
        String token = req == null ? null : req.refreshToken();
        return ApiResponse.ok(authService.refresh(token, request.getRemoteAddr()));
    }

    @PostMapping("/setup")
    public ResponseEntity<ApiResponse<UserSummary>> setup(@Valid @RequestBody SetupRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(authService.setup(req), "Super admin created successfully. Please login."));
    }

    @PostMapping("/logout")
    public ApiResponse<Void> logout(@AuthenticationPrincipal Principal principal,
                                    @RequestBody(required = false) LogoutRequest req) {
        authService.logout(principal, req == null ? null : req.refreshToken());
        return ApiResponse.ok(null, "Logged out successfully");
    }

    @GetMapping("/me")
    public ApiResponse<MeResponse> me(@AuthenticationPrincipal Principal principal) {
        return ApiResponse.ok(authService.me(principal));
    }

    @PostMapping("/tenants")
    public ResponseEntity<ApiResponse<TenantCreatedResponse>> createTenant(
            @AuthenticationPrincipal Principal principal,
            @Valid @RequestBody CreateTenantRequest req) {

        authorizationEngine.admit(principal, AccessPolicies.TENANT_CREATE, TenantRequest.none());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(authService.createTenantAndShopAdmin(principal, req)));
    }
}
