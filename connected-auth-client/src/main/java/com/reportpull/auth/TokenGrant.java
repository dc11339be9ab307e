package com.reportpull.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Form parameters for each grant the token endpoint accepts.
 */
public sealed interface TokenGrant {

    String JWT_BEARER_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    String grantType();

    Map<String, String> formParameters();

    record AuthorizationCode(String clientId, String code, String redirectUri, String codeVerifier,
                             String clientSecret) implements TokenGrant {
        public AuthorizationCode {
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(redirectUri, "redirectUri");
            Objects.requireNonNull(codeVerifier, "codeVerifier");
        }

        @Override
        public String grantType() {
            return "authorization_code";
        }

        @Override
        public Map<String, String> formParameters() {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", grantType());
            form.put("client_id", clientId);
            form.put("code", code);
            form.put("redirect_uri", redirectUri);
            form.put("code_verifier", codeVerifier);
            if (clientSecret != null && !clientSecret.isBlank()) {
                form.put("client_secret", clientSecret);
            }
            return form;
        }

        @Override
        public String toString() {
            return "AuthorizationCode[clientId=" + clientId + ", redirectUri=" + redirectUri
                + ", clientSecret=" + (clientSecret == null ? "absent" : "present") + "]";
        }
    }

    record RefreshToken(String clientId, String refreshToken) implements TokenGrant {
        public RefreshToken {
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(refreshToken, "refreshToken");
        }

        @Override
        public String grantType() {
            return "refresh_token";
        }

        @Override
        public Map<String, String> formParameters() {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", grantType());
            form.put("client_id", clientId);
            form.put("refresh_token", refreshToken);
            return form;
        }

        @Override
        public String toString() {
            return "RefreshToken[clientId=" + clientId + "]";
        }
    }

    record JwtBearer(String assertion) implements TokenGrant {
        public JwtBearer {
            Objects.requireNonNull(assertion, "assertion");
        }

        @Override
        public String grantType() {
            return JWT_BEARER_GRANT_TYPE;
        }

        @Override
        public Map<String, String> formParameters() {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", grantType());
            form.put("assertion", assertion);
            return form;
        }

        @Override
        public String toString() {
            return "JwtBearer[]";
        }
    }
}
