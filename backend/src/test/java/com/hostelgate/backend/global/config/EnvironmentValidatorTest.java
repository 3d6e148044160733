package com.hostelgate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/hostelgate")
                .withProperty("jwt.secret", "a-long-random-secret-for-tests-only-0123456789")
                .withProperty("jwt.expiration", "3600000")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173");
    }

    @Test
    @DisplayName("a complete configuration passes")
    void completeConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.collectProblems()).isEmpty();
        validator.validateEnvironment();
    }

    @Test
    @DisplayName("missing required properties are all reported and stop startup")
    void missingPropertiesFail() {
        MockEnvironment empty = new MockEnvironment();
        EnvironmentValidator validator = new EnvironmentValidator(empty);

        assertThat(validator.collectProblems()).containsExactly(
                "spring.datasource.url is missing",
                "jwt.secret is missing",
                "jwt.expiration is missing",
                "app.cors.allowed-origins is missing");
        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.secret is missing");
    }

    @Test
    @DisplayName("the development JWT secret is rejected only under the prod profile")
    void devSecretRejectedInProd() {
        environment.setProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();

        environment.setActiveProfiles("prod");
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret must be replaced with a random value");
    }

    @Test
    @DisplayName("token lifetime must be numeric and within bounds")
    void jwtExpirationBounds() {
        environment.setProperty("jwt.expiration", "1000");
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be between 300000 and 86400000 ms");

        environment.setProperty("jwt.expiration", "one-hour");
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be numeric");
    }

    @Test
    @DisplayName("enabling SMS requires an API key")
    void smsRequiresApiKey() {
        environment.setProperty("app.sms.enabled", "true");
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("app.sms.api-key is required when app.sms.enabled=true");

        environment.setProperty("app.sms.api-key", "key");
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }
}
