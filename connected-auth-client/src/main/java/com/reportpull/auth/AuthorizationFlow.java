package com.reportpull.auth;

/**
 * Obtains a brand-new token record when there is nothing to refresh.
 */
public interface AuthorizationFlow {

    TokenResult authenticate();
}
