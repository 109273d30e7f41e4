package com.meddiag.auth.service;

import com.meddiag.auth.dto.LoginRequest;
import com.meddiag.auth.dto.LogoutResponse;
import com.meddiag.auth.dto.MeResponse;
import com.meddiag.auth.dto.RegisterRequest;
import com.meddiag.auth.dto.TokenPair;
import com.meddiag.auth.model.AuthenticatedUser;
import com.meddiag.auth.model.Role;
import com.meddiag.gateway.verifier.CredentialVerifier;
import com.meddiag.gateway.verifier.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Optional;

/**
 * Login, registration, rotation and logout on top of {@link TokenAuthority}.
 *
 * <p>Failures that concern credentials or passwords all surface as {@link InvalidCredentialException},
 * so callers cannot tell an unknown user from a wrong password.</p>
 */
@Slf4j
public class AuthService {

    private final UserCredentialService users;
    private final TokenAuthority tokenAuthority;
    private final CredentialVerifier externalVerifier;
    private final BCryptPasswordEncoder passwordEncoder;

    /** Compared against when the user does not exist, so both paths cost one bcrypt check. */
    private final String dummyHash;

    public AuthService(
            UserCredentialService users,
            TokenAuthority tokenAuthority,
            CredentialVerifier externalVerifier,
            BCryptPasswordEncoder passwordEncoder
    ) {
        this.users = users;
        this.tokenAuthority = tokenAuthority;
        this.externalVerifier = externalVerifier;
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("meddiag-dummy-password");
    }

    public TokenPair login(LoginRequest request) {
        Optional<UserCredentialService.UserAccount> account = users.findByUsername(request.username());
        String hash = account.map(UserCredentialService.UserAccount::passwordHash).orElse(dummyHash);
        boolean matches = passwordEncoder.matches(request.password(), hash);
        if (account.isEmpty() || !matches) {
            log.debug("login failed: username={}", request.username());
            throw new InvalidCredentialException();
        }
        UserCredentialService.UserAccount user = account.get();
        return tokenAuthority.createTokenPair(user.username(), user.role());
    }

    /**
     * Self-service registration always yields the least privileged role.
     */
    public TokenPair register(RegisterRequest request) {
        String hash = passwordEncoder.encode(request.password());
        if (!users.register(request.username(), hash, Role.GP)) {
            throw new IllegalArgumentException("username_taken");
        }
        log.info("user registered: username={}", request.username());
        return tokenAuthority.createTokenPair(request.username(), Role.GP);
    }

    /**
     * Mail delivery is someone else's job; this only records the request. The answer never depends
     * on whether the account exists.
     */
    public void forgotPassword(String username) {
        boolean known = users.findByUsername(username).isPresent();
        log.info("password reset requested: username={}, known={}", username, known);
    }

    public TokenPair refresh(String refreshToken) {
        return tokenAuthority.rotate(refreshToken);
    }

    public LogoutResponse logout(String accessToken, String refreshToken) {
        boolean accessRevoked = accessToken != null && tokenAuthority.revoke(accessToken);
        boolean refreshRevoked = refreshToken != null && !refreshToken.isBlank() && tokenAuthority.revoke(refreshToken);
        return new LogoutResponse(accessRevoked, refreshRevoked);
    }

    /**
     * Trades a verified external identity-provider token for a pair of our own credentials.
     */
    public TokenPair exchangeExternal(String idToken) {
        VerificationResult result = externalVerifier.verify(idToken);
        if (!result.isVerified()) {
            throw new InvalidCredentialException();
        }
        AuthenticatedUser user = result.user();
        return tokenAuthority.createTokenPair(user.subject(), user.role());
    }

    public MeResponse me(AuthenticatedUser user) {
        return new MeResponse(user.subject(), user.role().getTag(), user.source());
    }
}
