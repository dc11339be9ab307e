package com.reportpull.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.reportpull.auth.store.CredentialStore;
import com.reportpull.auth.store.InMemorySecretBackend;
import com.reportpull.auth.store.TokenFileStore;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuthCacheTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(T0);
    private CredentialStore store;

    @BeforeEach
    void setUp() {
        store = new CredentialStore(new InMemorySecretBackend(), new TokenFileStore(tempDir));
    }

    @Test
    void servesCurrentTokenAndInstance() {
        store.save("salesforce", new TokenRecord("a", "r", "https://acme.my.salesforce.com", T0, T0.plusSeconds(3600)));
        AuthCache cache = new AuthCache(manager());

        assertThat(cache.get()).contains(new AuthCache.AuthInfo("a", "https://acme.my.salesforce.com"));
    }

    @Test
    void emptyOnceTokenEntersExpiryBuffer() {
        store.save("salesforce", new TokenRecord("a", "r", "https://acme.my.salesforce.com", T0, T0.plusSeconds(3600)));
        AuthCache cache = new AuthCache(manager());
        assertThat(cache.get()).isPresent();

        clock.advance(Duration.ofMinutes(55));

        assertThat(cache.get()).isEmpty();
    }

    @Test
    void recordChangesInvalidateTheCachedPair() {
        store.save("salesforce", new TokenRecord("a", "r", "https://acme.my.salesforce.com", T0, T0.plusSeconds(3600)));
        TokenLifecycleManager manager = manager();
        AuthCache cache = new AuthCache(manager);
        assertThat(cache.get()).get().extracting(AuthCache.AuthInfo::accessToken).isEqualTo("a");

        manager.clearCredentials();

        assertThat(cache.get()).isEmpty();
    }

    @Test
    void explicitInvalidateRebuildsFromManager() {
        store.save("salesforce", new TokenRecord("a", "r", null, T0, T0.plusSeconds(3600)));
        AuthCache cache = new AuthCache(manager());
        cache.get();

        cache.invalidate();

        assertThat(cache.get()).contains(new AuthCache.AuthInfo("a", "https://login.salesforce.com"));
    }

    @Test
    void toStringMasksToken() {
        assertThat(new AuthCache.AuthInfo("00Dxx0000001gPL!AQ4AQFakeToken", "https://x").toString())
            .doesNotContain("FakeToken");
    }

    private TokenLifecycleManager manager() {
        ServiceConfig config = ServiceConfig.builder().consumerKey("k").build();
        return new TokenLifecycleManager(config, mock(TokenExchanger.class), store, mock(AuthorizationFlow.class), clock);
    }
}
