package com.reportpull.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServiceConfigTest {

    @Test
    void defaultsMatchConnectedAppSetup() {
        ServiceConfig config = ServiceConfig.builder().consumerKey("key").build();

        assertThat(config.getServiceId()).isEqualTo("salesforce");
        assertThat(config.getScope()).isEqualTo("full refresh_token");
        assertThat(config.getCallbackPort()).isEqualTo(8080);
        assertThat(config.getCallbackPortRange()).isEqualTo(10);
        assertThat(config.getCallbackTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.getExpirySafetyBuffer()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getAuthMethod()).isEqualTo(AuthMethod.BROWSER_PKCE);
        assertThat(config.tokenEndpoint()).isEqualTo(URI.create("https://login.salesforce.com/services/oauth2/token"));
    }

    @Test
    void vanityDomainIsUsedForAuthorizationButNeverForTokenExchange() {
        ServiceConfig config = ServiceConfig.builder()
            .consumerKey("key")
            .instanceUrl("acme.my.salesforce.com/")
            .build();

        assertThat(config.authorizeEndpoint())
            .isEqualTo(URI.create("https://acme.my.salesforce.com/services/oauth2/authorize"));
        assertThat(config.tokenEndpoint())
            .isEqualTo(URI.create("https://login.salesforce.com/services/oauth2/token"));
    }

    @Test
    void sandboxUsesTestLoginHost() {
        ServiceConfig config = ServiceConfig.builder()
            .consumerKey("key")
            .environment(AuthEnvironment.SANDBOX)
            .instanceUrl("https://acme--dev.sandbox.my.salesforce.com")
            .build();

        assertThat(config.tokenHost()).isEqualTo(URI.create("https://test.salesforce.com"));
    }

    @Test
    void readsEnvironmentVariablesWithClientIdAlias() {
        ServiceConfig config = ServiceConfig.fromEnvironment("reports", Map.of(
            "SF_CLIENT_ID", "alias-key",
            "SF_JWT_SUBJECT", "integration@example.com",
            "SF_JWT_KEY_PATH", "/etc/keys/server.key",
            "SF_AUTH_METHOD", "jwt",
            "SF_INSTANCE_URL", "https://acme--uat.sandbox.my.salesforce.com"));

        assertThat(config.getServiceId()).isEqualTo("reports");
        assertThat(config.getConsumerKey()).isEqualTo("alias-key");
        assertThat(config.getAuthMethod()).isEqualTo(AuthMethod.JWT_BEARER);
        assertThat(config.getPrivateKeyPath()).isEqualTo(Path.of("/etc/keys/server.key"));
        assertThat(config.getEnvironment()).isEqualTo(AuthEnvironment.SANDBOX);
        assertThat(config.validate()).isSameAs(config);
    }

    @Test
    void consumerKeyTakesPrecedenceOverAlias() {
        ServiceConfig config = ServiceConfig.fromEnvironment("s", Map.of(
            "SF_CONSUMER_KEY", "primary",
            "SF_CLIENT_ID", "alias",
            "SF_ENVIRONMENT", "production"));

        assertThat(config.getConsumerKey()).isEqualTo("primary");
        assertThat(config.getEnvironment()).isEqualTo(AuthEnvironment.PRODUCTION);
    }

    @Test
    void validateNamesEveryMissingJwtField() {
        ServiceConfig config = ServiceConfig.builder().authMethod(AuthMethod.JWT_BEARER).build();

        assertThatThrownBy(config::validate)
            .isInstanceOfSatisfying(ConfigIncompleteException.class, e -> {
                assertThat(e.getKind()).isEqualTo(AuthErrorKind.CONFIG_INCOMPLETE);
                assertThat(e.getMissingFields()).hasSize(3);
                assertThat(e.getMessage()).contains("SF_CONSUMER_KEY", "SF_JWT_SUBJECT", "SF_JWT_KEY_PATH");
            });
    }

    @Test
    void pkceWithSecretRequiresTheSecret() {
        ServiceConfig config = ServiceConfig.builder()
            .consumerKey("key")
            .authMethod(AuthMethod.BROWSER_PKCE_WITH_SECRET)
            .build();

        assertThatThrownBy(config::validate)
            .isInstanceOf(ConfigIncompleteException.class)
            .hasMessageContaining("SF_CONSUMER_SECRET");
    }

    @Test
    void plainPkceAcceptsAnUnusedSecret() {
        ServiceConfig config = ServiceConfig.builder().consumerKey("key").consumerSecret("shh").build();

        assertThat(config.validate()).isSameAs(config);
        assertThat(config.toString()).doesNotContain("shh");
    }

    @Test
    void rejectsAssertionLifetimeAboveFiveMinutes() {
        ServiceConfig config = ServiceConfig.builder()
            .consumerKey("key")
            .assertionLifetime(Duration.ofMinutes(6))
            .build();

        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnknownAuthMethod() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment("s", Map.of("SF_AUTH_METHOD", "saml")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("saml");
    }
}
