package com.meddiag.config;

import com.meddiag.auth.config.AuthProperties;
import com.meddiag.auth.model.Role;
import com.meddiag.common.ratelimit.RateLimitPolicy;
import com.meddiag.common.ratelimit.RateLimitProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ApplicationYamlParseTest {

    @Test
    void applicationYaml_ShouldBeParsable() throws Exception {
        var loader = new YamlPropertySourceLoader();
        var sources = loader.load("application", new ClassPathResource("application.yml"));
        assertNotNull(sources);
        assertFalse(sources.isEmpty());
    }

    @Test
    void rateLimitPolicies_ShouldBindIncludingUnderscoredNames() throws Exception {
        Map<String, RateLimitPolicy> table = binder()
                .bind("meddiag.ratelimit", RateLimitProperties.class)
                .get()
                .toPolicyTable();

        assertThat(table).containsOnlyKeys("login", "register", "forgot_password", "google_auth", "default");
        assertThat(table.get("login")).isEqualTo(new RateLimitPolicy(5, 60, 300));
        assertThat(table.get("forgot_password")).isEqualTo(new RateLimitPolicy(3, 60, 300));
        assertThat(table.get("default")).isEqualTo(new RateLimitPolicy(60, 60, 0));
    }

    @Test
    void demoUsers_ShouldBindWithWorkingBcryptHashes() throws Exception {
        AuthProperties props = binder().bind("meddiag.auth", AuthProperties.class).get();
        BCryptPasswordEncoder encoder = new BCryptPasswordEncoder();

        assertThat(props.users()).containsOnlyKeys("admin", "doctor", "nurse", "auditor");
        assertThat(encoder.matches("admin123", props.users().get("admin").passwordHash())).isTrue();
        assertThat(encoder.matches("doctor123", props.users().get("doctor").passwordHash())).isTrue();
        assertThat(encoder.matches("nurse123", props.users().get("nurse").passwordHash())).isTrue();
        assertThat(encoder.matches("auditor123", props.users().get("auditor").passwordHash())).isTrue();
        props.users().values().forEach(u -> assertThat(Role.fromTag(u.role())).isPresent());
        assertThat(props.external().isEnabled()).isFalse();
    }

    private static Binder binder() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        return new Binder(ConfigurationPropertySources.from(sources), new PropertySourcesPlaceholdersResolver(sources));
    }
}
