package com.meddiag.auth.service;

import java.time.Instant;

/**
 * Revoked token ids.
 *
 * <p>An entry only has to outlive the credential it revokes: once {@code expiresAt} passed the
 * credential fails the expiry check anyway, so implementations may drop it.</p>
 */
public interface RevocationStore {

    /**
     * Marks {@code tokenId} revoked until {@code expiresAt} (idempotent).
     *
     * @return false if the entry could not be recorded
     */
    boolean revoke(String tokenId, Instant expiresAt);

    /**
     * Atomic revoke used by refresh-token rotation.
     *
     * @return true if this call revoked the id, false if it was already revoked or could not be recorded
     */
    boolean revokeIfAbsent(String tokenId, Instant expiresAt);

    boolean isRevoked(String tokenId);
}
