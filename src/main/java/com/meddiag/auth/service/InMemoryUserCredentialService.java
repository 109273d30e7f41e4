package com.meddiag.auth.service;

import com.meddiag.auth.config.AuthProperties;
import com.meddiag.auth.model.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accounts seeded from {@code meddiag.auth.users.*}, plus anything registered at runtime.
 */
@Slf4j
public class InMemoryUserCredentialService implements UserCredentialService {

    private final Map<String, UserAccount> accounts = new ConcurrentHashMap<>();

    public InMemoryUserCredentialService(AuthProperties props) {
        props.users().forEach((name, user) -> {
            Optional<Role> role = Role.fromTag(user.role());
            if (role.isEmpty() || user.passwordHash() == null || user.passwordHash().isBlank()) {
                log.warn("skip configured user with invalid role or password hash: username={}", name);
                return;
            }
            accounts.put(normalize(name), new UserAccount(name, user.passwordHash(), role.get()));
        });
        log.info("in-memory user store seeded: users={}", accounts.size());
    }

    @Override
    public Optional<UserAccount> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accounts.get(normalize(username)));
    }

    @Override
    public boolean register(String username, String passwordHash, Role role) {
        return accounts.putIfAbsent(normalize(username), new UserAccount(username, passwordHash, role)) == null;
    }

    private static String normalize(String username) {
        return username.trim().toLowerCase(Locale.ROOT);
    }
}
