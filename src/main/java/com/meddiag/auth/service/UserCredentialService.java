package com.meddiag.auth.service;

import com.meddiag.auth.model.Role;

import java.util.Optional;

/**
 * Where login looks accounts up. The persistence layer plugs in its own implementation;
 * {@link InMemoryUserCredentialService} is the default.
 */
public interface UserCredentialService {

    record UserAccount(String username, String passwordHash, Role role) {
    }

    Optional<UserAccount> findByUsername(String username);

    /**
     * @return false if the username is taken
     */
    boolean register(String username, String passwordHash, Role role);
}
