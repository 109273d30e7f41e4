package com.meddiag.auth.service;

import com.meddiag.auth.config.AuthProperties;
import com.meddiag.auth.model.TokenKind;
import io.jsonwebtoken.security.Keys;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * The two HMAC keys used by {@link TokenAuthority}.
 *
 * <p>Access and refresh credentials are signed with different keys, so a leaked refresh key
 * cannot be used to mint access tokens (and the other way round).</p>
 */
public final class SigningKeys {

    static final String REFRESH_DERIVATION_LABEL = "meddiag-refresh-key";
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    private SigningKeys(SecretKey accessKey, SecretKey refreshKey) {
        this.accessKey = accessKey;
        this.refreshKey = refreshKey;
    }

    public static SigningKeys from(AuthProperties props) {
        String secret = props.jwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("meddiag.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        byte[] accessBytes = secret.getBytes(StandardCharsets.UTF_8);

        byte[] refreshBytes;
        String refreshSecret = props.refreshSecret();
        if (refreshSecret == null || refreshSecret.isBlank()) {
            refreshBytes = derive(accessBytes, REFRESH_DERIVATION_LABEL);
        } else {
            refreshBytes = refreshSecret.getBytes(StandardCharsets.UTF_8);
            if (refreshBytes.length < MIN_SECRET_BYTES) {
                throw new IllegalStateException("meddiag.auth.refresh-secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
        }
        if (MessageDigest.isEqual(accessBytes, refreshBytes)) {
            throw new IllegalStateException("access and refresh signing secrets must differ");
        }
        return new SigningKeys(Keys.hmacShaKeyFor(accessBytes), Keys.hmacShaKeyFor(refreshBytes));
    }

    public SecretKey keyFor(TokenKind kind) {
        return kind == TokenKind.REFRESH ? refreshKey : accessKey;
    }

    static byte[] derive(byte[] secret, String label) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            return mac.doFinal(label.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
