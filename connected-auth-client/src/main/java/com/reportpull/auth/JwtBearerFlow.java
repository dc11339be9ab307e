package com.reportpull.auth;

import java.util.Objects;

import com.reportpull.auth.assertion.AssertionSigner;
import com.reportpull.auth.assertion.JwtAssertion;
import com.reportpull.auth.assertion.JwtAssertionSigner;

import lombok.extern.slf4j.Slf4j;

/**
 * Server-to-server flow: a freshly signed assertion is traded for an access token.
 * No refresh token is issued; the manager simply runs this flow again.
 */
@Slf4j
public class JwtBearerFlow implements AuthorizationFlow {

    private final ServiceConfig config;
    private final TokenExchanger exchanger;
    private final AssertionSigner signer;

    public JwtBearerFlow(ServiceConfig config, TokenExchanger exchanger) {
        this(config, exchanger, new JwtAssertionSigner());
    }

    public JwtBearerFlow(ServiceConfig config, TokenExchanger exchanger, AssertionSigner signer) {
        this.config = Objects.requireNonNull(config, "config");
        this.exchanger = Objects.requireNonNull(exchanger, "exchanger");
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    /**
     * @throws com.reportpull.auth.assertion.AssertionSigningException when the key cannot be
     *         read or used; raised before the token endpoint is contacted
     */
    @Override
    public TokenResult authenticate() {
        JwtAssertion assertion = signer.sign(
            config.getConsumerKey(),
            config.getJwtSubject(),
            audience(),
            config.getPrivateKeyPath(),
            config.getKeyId(),
            config.getAssertionLifetime());
        log.info("Signed JWT assertion for subject {} (aud {}, exp {})",
            assertion.subject(), assertion.audience(), assertion.expiresAt());
        return exchanger.exchange(new TokenGrant.JwtBearer(assertion.compact()));
    }

    String audience() {
        String host = config.tokenHost().toString();
        while (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }
}
