package com.meddiag.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddiag.auth.service.AuthService;
import com.meddiag.auth.service.InMemoryRevocationStore;
import com.meddiag.auth.service.InMemoryUserCredentialService;
import com.meddiag.auth.service.RedisRevocationStore;
import com.meddiag.auth.service.RevocationStore;
import com.meddiag.auth.service.TokenAuthority;
import com.meddiag.auth.service.UserCredentialService;
import com.meddiag.gateway.verifier.ExternalIdpCredentialVerifier;
import com.meddiag.gateway.verifier.LocalCredentialVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthConfig {

    @Bean
    public RevocationStore revocationStore(AuthProperties props, ObjectProvider<StringRedisTemplate> redis, Clock clock) {
        if ("redis".equalsIgnoreCase(props.revocationStore())) {
            StringRedisTemplate template = redis.getIfAvailable();
            if (template != null) {
                log.info("revocation store: redis");
                return new RedisRevocationStore(template, clock);
            }
            log.warn("revocation store: redis requested but no StringRedisTemplate, using memory");
        }
        return new InMemoryRevocationStore(clock);
    }

    @Bean
    public TokenAuthority tokenAuthority(AuthProperties props, RevocationStore revocationStore, Clock clock) {
        return new TokenAuthority(props, revocationStore, clock);
    }

    @Bean
    public BCryptPasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    @ConditionalOnMissingBean(UserCredentialService.class)
    public UserCredentialService userCredentialService(AuthProperties props) {
        return new InMemoryUserCredentialService(props);
    }

    @Bean
    public LocalCredentialVerifier localCredentialVerifier(TokenAuthority tokenAuthority, ObjectMapper objectMapper) {
        return new LocalCredentialVerifier(tokenAuthority, objectMapper);
    }

    @Bean
    public ExternalIdpCredentialVerifier externalIdpCredentialVerifier(AuthProperties props, ObjectMapper objectMapper, Clock clock) {
        return new ExternalIdpCredentialVerifier(props.external(), objectMapper, clock);
    }

    @Bean
    public AuthService authService(UserCredentialService users,
                                   TokenAuthority tokenAuthority,
                                   ExternalIdpCredentialVerifier externalVerifier,
                                   BCryptPasswordEncoder passwordEncoder) {
        return new AuthService(users, tokenAuthority, externalVerifier, passwordEncoder);
    }
}
