package com.reportpull.auth.pkce;

import java.net.URI;

/**
 * A started authorization: the URL to send the user to, the attempt it belongs to,
 * and the listener already bound for its redirect.
 */
public record AuthorizationRequest(URI authorizationUrl, PkceAttempt attempt, CallbackListener listener) {
}
