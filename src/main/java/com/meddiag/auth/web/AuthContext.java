package com.meddiag.auth.web;

import com.meddiag.auth.model.AuthenticatedUser;

/**
 * Identity of the current request, set by the gatekeeper interceptor.
 *
 * <p>ThreadLocal: cleared in {@code GatekeeperInterceptor#afterCompletion}, otherwise a pooled thread
 * would carry the previous caller into the next request.</p>
 */
public final class AuthContext {

    private static final ThreadLocal<AuthenticatedUser> USER = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUser(AuthenticatedUser user) {
        USER.set(user);
    }

    public static AuthenticatedUser getUser() {
        return USER.get();
    }

    public static void clear() {
        USER.remove();
    }
}
