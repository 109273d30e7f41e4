package com.meddiag.auth.service;

/**
 * The single outcome of every failed credential check.
 *
 * <p>Malformed, badly signed, expired, wrong-kind and revoked credentials all end up here with the
 * same message; the cause is kept for server-side debugging only and never rendered.</p>
 */
public class InvalidCredentialException extends RuntimeException {

    public static final String MESSAGE = "invalid_credential";

    public InvalidCredentialException() {
        super(MESSAGE);
    }

    public InvalidCredentialException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
