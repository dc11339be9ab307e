package com.reportpull.auth;

public enum AuthErrorKind {
    CONFIG_INCOMPLETE,
    CALLBACK_PORT_UNAVAILABLE,
    BROWSER_LAUNCH_FAILED,
    CALLBACK_TIMEOUT,
    CALLBACK_PROVIDER_ERROR,
    CALLBACK_MALFORMED,
    CALLBACK_HANDLING_FAILED,
    TOKEN_EXCHANGE_HTTP_ERROR,
    TOKEN_EXCHANGE_NETWORK_ERROR,
    SESSION_BINDING_ERROR,
    REAUTHENTICATION_REQUIRED
}
