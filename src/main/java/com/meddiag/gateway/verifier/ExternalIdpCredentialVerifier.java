package com.meddiag.gateway.verifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddiag.auth.config.AuthProperties;
import com.meddiag.auth.model.AuthenticatedUser;
import com.meddiag.auth.model.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Tokens from the external identity provider, HS256 with a shared secret.
 *
 * <p>A credential belongs here when its {@code iss} matches the configured external issuer, or, with no
 * issuer configured, when its {@code aud} matches the configured audience. Role comes from the
 * {@code user_role} claim and defaults to {@link Role#GP}.</p>
 */
@Slf4j
public class ExternalIdpCredentialVerifier implements CredentialVerifier {

    public static final String CLAIM_USER_ROLE = "user_role";
    public static final String CLAIM_EMAIL = "email";

    private final AuthProperties.External props;
    private final ObjectMapper objectMapper;
    private final JwtParser parser;

    public ExternalIdpCredentialVerifier(AuthProperties.External props, ObjectMapper objectMapper, Clock clock) {
        this.props = props;
        this.objectMapper = objectMapper;
        if (props.isEnabled()) {
            JwtParserBuilder builder = Jwts.parser()
                    .verifyWith(Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8)))
                    .requireAudience(props.audience())
                    .clock(() -> Date.from(clock.instant()));
            if (hasIssuer()) {
                builder.requireIssuer(props.issuer());
            }
            this.parser = builder.build();
        } else {
            this.parser = null;
        }
    }

    @Override
    public String name() {
        return "external";
    }

    @Override
    public VerificationResult verify(String credential) {
        if (parser == null) {
            return VerificationResult.notApplicable();
        }
        CredentialShape shape = CredentialShape.peek(credential, objectMapper);
        if (shape == null || !belongsHere(shape)) {
            return VerificationResult.notApplicable();
        }
        try {
            Claims claims = parser.parseSignedClaims(credential).getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                return VerificationResult.rejected();
            }
            Role role = Role.fromTag(claims.get(CLAIM_USER_ROLE, String.class)).orElse(Role.GP);
            return VerificationResult.verified(new AuthenticatedUser(subject, role, AuthenticatedUser.SOURCE_EXTERNAL));
        } catch (RuntimeException e) {
            log.debug("external credential rejected: err={}", e.getClass().getSimpleName());
            return VerificationResult.rejected();
        }
    }

    private boolean belongsHere(CredentialShape shape) {
        if (hasIssuer()) {
            return props.issuer().equals(shape.issuer());
        }
        return props.audience().equals(shape.audience());
    }

    private boolean hasIssuer() {
        return props.issuer() != null && !props.issuer().isBlank();
    }
}
