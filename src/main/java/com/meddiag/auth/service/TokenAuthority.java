package com.meddiag.auth.service;

import com.meddiag.auth.config.AuthProperties;
import com.meddiag.auth.dto.TokenPair;
import com.meddiag.auth.model.CredentialClaims;
import com.meddiag.auth.model.Role;
import com.meddiag.auth.model.TokenKind;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mints, verifies, rotates and revokes the service's own credentials.
 *
 * <p>Credentials are compact HS256 JWS strings ({@code header.payload.signature}). Claims:</p>
 * <ul>
 *   <li>{@code sub}: subject (username)</li>
 *   <li>{@code role}: one of the {@link Role} tags</li>
 *   <li>{@code kind}: {@code access} or {@code refresh}; each kind is signed with its own key</li>
 *   <li>{@code jti}: 128 random bits, the handle used for revocation</li>
 *   <li>{@code iss}, {@code iat}, {@code exp}</li>
 * </ul>
 *
 * <p>Nothing is stored per session. The only server-side state is the {@link RevocationStore}.</p>
 */
@Slf4j
public class TokenAuthority {

    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_KIND = "kind";
    public static final String TOKEN_TYPE_BEARER = "bearer";

    private static final int TOKEN_ID_BYTES = 16;

    private final AuthProperties props;
    private final SigningKeys keys;
    private final RevocationStore revocationStore;
    private final Clock clock;
    private final Map<TokenKind, JwtParser> parsers = new EnumMap<>(TokenKind.class);
    private final SecureRandom secureRandom = new SecureRandom();

    public TokenAuthority(AuthProperties props, RevocationStore revocationStore, Clock clock) {
        this.props = props;
        this.keys = SigningKeys.from(props);
        this.revocationStore = revocationStore;
        this.clock = clock;
        for (TokenKind kind : TokenKind.values()) {
            parsers.put(kind, Jwts.parser()
                    .verifyWith(keys.keyFor(kind))
                    .requireIssuer(props.issuer())
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(props.clockSkewSeconds())
                    .build());
        }
    }

    public String createAccessToken(String subject, Role role, Duration ttl) {
        return create(subject, role, TokenKind.ACCESS, ttl);
    }

    public String createRefreshToken(String subject, Role role, Duration ttl) {
        return create(subject, role, TokenKind.REFRESH, ttl);
    }

    public TokenPair createTokenPair(String subject, Role role) {
        long accessTtl = props.accessTokenTtlSeconds();
        String access = createAccessToken(subject, role, Duration.ofSeconds(accessTtl));
        String refresh = createRefreshToken(subject, role, Duration.ofSeconds(props.refreshTokenTtlSeconds()));
        return new TokenPair(access, refresh, TOKEN_TYPE_BEARER, accessTtl);
    }

    /**
     * Full verification: signature with the key of {@code expectKind}, expiry, kind and revocation.
     *
     * @throws InvalidCredentialException on any failure, without telling which check failed
     */
    public CredentialClaims verify(String credential, TokenKind expectKind) {
        CredentialClaims claims = decode(credential, expectKind);
        if (revocationStore.isRevoked(claims.tokenId())) {
            log.debug("credential rejected: revoked, jti={}", claims.tokenId());
            throw new InvalidCredentialException();
        }
        return claims;
    }

    /**
     * Revokes a credential of either kind until its own expiry.
     *
     * @return false when the credential does not verify under either key (or already expired), or the
     *         revocation could not be recorded
     */
    public boolean revoke(String credential) {
        CredentialClaims claims = tryDecode(credential, TokenKind.ACCESS);
        if (claims == null) {
            claims = tryDecode(credential, TokenKind.REFRESH);
        }
        if (claims == null) {
            return false;
        }
        if (!revocationStore.revoke(claims.tokenId(), claims.expiresAt())) {
            return false;
        }
        log.info("credential revoked: kind={}, sub={}, jti={}", claims.kind().getClaimValue(), claims.subject(), claims.tokenId());
        return true;
    }

    /**
     * Exchanges a refresh credential for a brand-new pair; the presented one becomes unusable.
     *
     * <p>Of two concurrent rotations of the same refresh credential exactly one succeeds.</p>
     *
     * @throws InvalidCredentialException when the refresh credential is invalid or already used
     */
    public TokenPair rotate(String refreshCredential) {
        CredentialClaims claims = verify(refreshCredential, TokenKind.REFRESH);
        if (!revocationStore.revokeIfAbsent(claims.tokenId(), claims.expiresAt())) {
            log.warn("refresh credential replayed: sub={}, jti={}", claims.subject(), claims.tokenId());
            throw new InvalidCredentialException();
        }
        return createTokenPair(claims.subject(), claims.role());
    }

    public String issuer() {
        return props.issuer();
    }

    private String create(String subject, Role role, TokenKind kind, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject_required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role_required");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl_must_be_positive");
        }
        Instant now = clock.instant();
        Instant exp = now.plus(ttl);

        return Jwts.builder()
                .header().type("JWT").and()
                .issuer(props.issuer())
                .subject(subject)
                .id(newTokenId())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .claim(CLAIM_ROLE, role.getTag())
                .claim(CLAIM_KIND, kind.getClaimValue())
                .signWith(keys.keyFor(kind), Jwts.SIG.HS256)
                .compact();
    }

    private CredentialClaims tryDecode(String credential, TokenKind kind) {
        try {
            return decode(credential, kind);
        } catch (InvalidCredentialException e) {
            return null;
        }
    }

    private CredentialClaims decode(String credential, TokenKind expectKind) {
        if (credential == null || segmentCount(credential) != 3) {
            throw new InvalidCredentialException();
        }
        Claims claims;
        try {
            claims = parsers.get(expectKind).parseSignedClaims(credential).getPayload();
        } catch (RuntimeException e) {
            log.debug("credential rejected: kind={}, err={}", expectKind.getClaimValue(), e.getClass().getSimpleName());
            throw new InvalidCredentialException(e);
        }
        try {
            return toCredentialClaims(claims, expectKind);
        } catch (InvalidCredentialException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidCredentialException(e);
        }
    }

    private CredentialClaims toCredentialClaims(Claims claims, TokenKind expectKind) {
        String kindClaim = claims.get(CLAIM_KIND, String.class);
        TokenKind kind = kindClaim == null ? null : TokenKind.fromClaim(kindClaim);
        if (kindClaim != null && kind != expectKind) {
            throw new InvalidCredentialException();
        }
        if (kind == null) {
            // access tokens minted before the kind claim existed carry none; refresh always does
            if (expectKind == TokenKind.REFRESH) {
                throw new InvalidCredentialException();
            }
            kind = TokenKind.ACCESS;
        }

        Date exp = claims.getExpiration();
        if (exp == null) {
            throw new InvalidCredentialException();
        }
        Instant expiresAt = exp.toInstant();
        if (!expiresAt.plusSeconds(props.clockSkewSeconds()).isAfter(clock.instant())) {
            throw new InvalidCredentialException();
        }

        String subject = claims.getSubject();
        String tokenId = claims.getId();
        Role role = Role.fromTag(claims.get(CLAIM_ROLE, String.class)).orElse(null);
        if (subject == null || subject.isBlank() || tokenId == null || tokenId.isBlank() || role == null) {
            throw new InvalidCredentialException();
        }
        Date iat = claims.getIssuedAt();
        return new CredentialClaims(subject, role, kind, iat == null ? null : iat.toInstant(), expiresAt, tokenId);
    }

    private String newTokenId() {
        byte[] bytes = new byte[TOKEN_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static int segmentCount(String credential) {
        int count = 1;
        for (int i = 0; i < credential.length(); i++) {
            if (credential.charAt(i) == '.') {
                count++;
            }
        }
        return count;
    }
}
