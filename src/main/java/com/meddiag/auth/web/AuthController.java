package com.meddiag.auth.web;

import com.meddiag.auth.dto.ExternalExchangeRequest;
import com.meddiag.auth.dto.ForgotPasswordRequest;
import com.meddiag.auth.dto.LoginRequest;
import com.meddiag.auth.dto.LogoutRequest;
import com.meddiag.auth.dto.LogoutResponse;
import com.meddiag.auth.dto.MeResponse;
import com.meddiag.auth.dto.MessageResponse;
import com.meddiag.auth.dto.RefreshRequest;
import com.meddiag.auth.dto.RegisterRequest;
import com.meddiag.auth.dto.TokenPair;
import com.meddiag.auth.model.AuthenticatedUser;
import com.meddiag.auth.service.AuthService;
import com.meddiag.auth.service.InvalidCredentialException;
import com.meddiag.common.api.Result;
import com.meddiag.gateway.Gatekeeper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication endpoints.
 *
 * <p>Two credentials per session:</p>
 * <ul>
 *   <li>access token: short-lived, sent as {@code Authorization: Bearer} on every call</li>
 *   <li>refresh token: long-lived, single use; {@code /auth/refresh} swaps it for a new pair</li>
 * </ul>
 *
 * <p>Rate limits and identity checks happen in the gatekeeper before any of these run.</p>
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    public Result<TokenPair> login(@Valid @RequestBody LoginRequest request) {
        return Result.ok(authService.login(request));
    }

    @PostMapping("/register")
    public Result<TokenPair> register(@Valid @RequestBody RegisterRequest request) {
        return Result.ok(authService.register(request));
    }

    @PostMapping("/forgot-password")
    public Result<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request.username());
        return Result.ok(new MessageResponse("If the account exists, reset instructions have been sent"));
    }

    @PostMapping("/external/exchange")
    public Result<TokenPair> exchange(@Valid @RequestBody ExternalExchangeRequest request) {
        return Result.ok(authService.exchangeExternal(request.idToken()));
    }

    /**
     * The presented refresh token is revoked; replaying it later yields 401.
     */
    @PostMapping("/refresh")
    public Result<TokenPair> refresh(@Valid @RequestBody RefreshRequest request) {
        return Result.ok(authService.refresh(request.refreshToken()));
    }

    @PostMapping("/logout")
    public Result<LogoutResponse> logout(HttpServletRequest http, @RequestBody(required = false) LogoutRequest request) {
        String accessToken = Gatekeeper.extractBearer(http);
        String refreshToken = request == null ? null : request.refreshToken();
        return Result.ok(authService.logout(accessToken, refreshToken));
    }

    @GetMapping("/me")
    public Result<MeResponse> me() {
        AuthenticatedUser user = AuthContext.getUser();
        if (user == null) {
            throw new InvalidCredentialException();
        }
        return Result.ok(authService.me(user));
    }
}
