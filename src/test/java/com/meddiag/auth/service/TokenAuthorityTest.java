package com.meddiag.auth.service;

import com.meddiag.auth.config.AuthProperties;
import com.meddiag.auth.dto.TokenPair;
import com.meddiag.auth.model.CredentialClaims;
import com.meddiag.auth.model.Role;
import com.meddiag.auth.model.TokenKind;
import com.meddiag.support.MutableClock;
import com.meddiag.support.TestAuth;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenAuthorityTest {

    private MutableClock clock;
    private TokenAuthority authority;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        authority = new TokenAuthority(TestAuth.props(), new InMemoryRevocationStore(clock), clock);
    }

    @Test
    void verify_ShouldReturnSubjectAndRole_BeforeTtlElapses() {
        String token = authority.createAccessToken("doctor", Role.SPECIALIST, Duration.ofSeconds(60));

        clock.advanceSeconds(59);
        CredentialClaims claims = authority.verify(token, TokenKind.ACCESS);

        assertThat(claims.subject()).isEqualTo("doctor");
        assertThat(claims.role()).isEqualTo(Role.SPECIALIST);
        assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(claims.tokenId()).isNotBlank();
        assertThat(claims.expiresAt()).isEqualTo(claims.issuedAt().plusSeconds(60));
    }

    @Test
    void verify_ShouldFail_OnceExpiresAtReached() {
        String token = authority.createAccessToken("doctor", Role.SPECIALIST, Duration.ofSeconds(60));

        clock.advanceSeconds(60);

        assertThatThrownBy(() -> authority.verify(token, TokenKind.ACCESS))
                .isInstanceOf(InvalidCredentialException.class)
                .hasMessage(InvalidCredentialException.MESSAGE);
    }

    @Test
    void verify_ShouldAllowConfiguredClockSkew() {
        AuthProperties props = new AuthProperties("meddiag", TestAuth.SECRET, null, 900, 3600, 30, "memory", null, null);
        TokenAuthority lenient = new TokenAuthority(props, new InMemoryRevocationStore(clock), clock);
        String token = lenient.createAccessToken("nurse", Role.GP, Duration.ofSeconds(60));

        clock.advanceSeconds(75);
        assertThat(lenient.verify(token, TokenKind.ACCESS).subject()).isEqualTo("nurse");

        clock.advanceSeconds(20);
        assertThatThrownBy(() -> lenient.verify(token, TokenKind.ACCESS)).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void verify_ShouldFail_WhenAnyPayloadCharacterIsFlipped() {
        String token = authority.createAccessToken("admin", Role.ADMIN, Duration.ofMinutes(5));
        String[] parts = token.split("\\.");
        String payload = parts[1];

        for (int i = 0; i < payload.length(); i++) {
            char original = payload.charAt(i);
            char flipped = original == 'A' ? 'B' : 'A';
            String tamperedPayload = payload.substring(0, i) + flipped + payload.substring(i + 1);
            String tampered = parts[0] + "." + tamperedPayload + "." + parts[2];

            assertThatThrownBy(() -> authority.verify(tampered, TokenKind.ACCESS))
                    .as("flip at %d", i)
                    .isInstanceOf(InvalidCredentialException.class);
        }
    }

    @Test
    void verify_ShouldRejectCrossKindUse() {
        String access = authority.createAccessToken("nurse", Role.GP, Duration.ofMinutes(5));
        String refresh = authority.createRefreshToken("nurse", Role.GP, Duration.ofDays(1));

        assertThatThrownBy(() -> authority.verify(access, TokenKind.REFRESH)).isInstanceOf(InvalidCredentialException.class);
        assertThatThrownBy(() -> authority.verify(refresh, TokenKind.ACCESS)).isInstanceOf(InvalidCredentialException.class);
        assertThat(authority.verify(refresh, TokenKind.REFRESH).kind()).isEqualTo(TokenKind.REFRESH);
    }

    @Test
    void verify_ShouldRejectRefreshKindSignedWithAccessKey() {
        // a refresh-kind claim is worthless unless it is signed with the refresh key
        String forged = Jwts.builder()
                .issuer("meddiag")
                .subject("mallory")
                .id("forged-id")
                .issuedAt(Date.from(clock.instant()))
                .expiration(Date.from(clock.instant().plusSeconds(600)))
                .claim(TokenAuthority.CLAIM_ROLE, "admin")
                .claim(TokenAuthority.CLAIM_KIND, "refresh")
                .signWith(Keys.hmacShaKeyFor(TestAuth.SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> authority.verify(forged, TokenKind.REFRESH)).isInstanceOf(InvalidCredentialException.class);
        assertThatThrownBy(() -> authority.rotate(forged)).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void verify_ShouldRejectMalformedAndUnsignedInput() {
        String valid = authority.createAccessToken("nurse", Role.GP, Duration.ofMinutes(5));
        String[] parts = valid.split("\\.");
        String unsignedHeader = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));

        List<String> inputs = List.of(
                "",
                "abc",
                parts[0] + "." + parts[1],
                valid + ".extra",
                unsignedHeader + "." + parts[1] + ".",
                "%%%.%%%.%%%"
        );
        for (String input : inputs) {
            assertThatThrownBy(() -> authority.verify(input, TokenKind.ACCESS))
                    .as(input)
                    .isInstanceOf(InvalidCredentialException.class);
        }
        assertThatThrownBy(() -> authority.verify(null, TokenKind.ACCESS)).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void verify_ShouldRejectTokenFromAnotherIssuer() {
        AuthProperties other = AuthProperties.of("someone-else", TestAuth.SECRET, 900, 3600);
        TokenAuthority foreign = new TokenAuthority(other, new InMemoryRevocationStore(clock), clock);
        String token = foreign.createAccessToken("admin", Role.ADMIN, Duration.ofMinutes(5));

        assertThatThrownBy(() -> authority.verify(token, TokenKind.ACCESS)).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void revoke_ShouldInvalidateUnexpiredToken_AndBeIdempotent() {
        String token = authority.createAccessToken("doctor", Role.SPECIALIST, Duration.ofMinutes(30));

        assertThat(authority.revoke(token)).isTrue();
        assertThat(authority.revoke(token)).isTrue();

        assertThatThrownBy(() -> authority.verify(token, TokenKind.ACCESS)).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void revoke_ShouldAcceptRefreshTokens_AndRefuseGarbage() {
        String refresh = authority.createRefreshToken("doctor", Role.SPECIALIST, Duration.ofDays(1));

        assertThat(authority.revoke(refresh)).isTrue();
        assertThatThrownBy(() -> authority.verify(refresh, TokenKind.REFRESH)).isInstanceOf(InvalidCredentialException.class);

        assertThat(authority.revoke("not.a.token")).isFalse();
        assertThat(authority.revoke(null)).isFalse();
    }

    @Test
    void createTokenPair_ShouldUseConfiguredTtls() {
        TokenPair pair = authority.createTokenPair("nurse", Role.GP);

        assertThat(pair.tokenType()).isEqualTo("bearer");
        assertThat(pair.expiresIn()).isEqualTo(900);
        CredentialClaims access = authority.verify(pair.accessToken(), TokenKind.ACCESS);
        CredentialClaims refresh = authority.verify(pair.refreshToken(), TokenKind.REFRESH);
        assertThat(access.expiresAt()).isEqualTo(clock.instant().plusSeconds(900));
        assertThat(refresh.expiresAt()).isEqualTo(clock.instant().plusSeconds(7 * 24 * 3600));
        assertThat(access.tokenId()).isNotEqualTo(refresh.tokenId());
    }

    @Test
    void rotate_ShouldSucceedExactlyOnce() {
        TokenPair initial = authority.createTokenPair("admin", Role.ADMIN);

        TokenPair rotated = authority.rotate(initial.refreshToken());

        assertThat(rotated.refreshToken()).isNotEqualTo(initial.refreshToken());
        assertThat(authority.verify(rotated.accessToken(), TokenKind.ACCESS).role()).isEqualTo(Role.ADMIN);
        assertThat(authority.verify(rotated.refreshToken(), TokenKind.REFRESH).subject()).isEqualTo("admin");
        assertThatThrownBy(() -> authority.rotate(initial.refreshToken())).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void rotate_ShouldRejectAccessToken() {
        TokenPair pair = authority.createTokenPair("admin", Role.ADMIN);

        assertThatThrownBy(() -> authority.rotate(pair.accessToken())).isInstanceOf(InvalidCredentialException.class);
    }

    @Test
    void rotate_ShouldLetOnlyOneConcurrentCallerWin() throws Exception {
        TokenPair pair = authority.createTokenPair("doctor", Role.SPECIALIST);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    try {
                        authority.rotate(pair.refreshToken());
                        return true;
                    } catch (InvalidCredentialException e) {
                        return false;
                    }
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int wins = 0;
            for (Future<Boolean> f : results) {
                if (f.get()) {
                    wins++;
                }
            }
            assertThat(wins).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void create_ShouldRejectBlankSubjectAndNonPositiveTtl() {
        assertThatThrownBy(() -> authority.createAccessToken(" ", Role.GP, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> authority.createAccessToken("nurse", Role.GP, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> authority.createRefreshToken("nurse", null, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
