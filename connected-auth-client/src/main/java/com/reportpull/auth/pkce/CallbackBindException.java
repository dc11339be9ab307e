package com.reportpull.auth.pkce;

import com.reportpull.auth.AuthErrorKind;
import com.reportpull.auth.AuthException;

/**
 * No port in the configured range could be bound for the redirect listener.
 */
public class CallbackBindException extends AuthException {

    public CallbackBindException(String message, Throwable cause) {
        super(AuthErrorKind.CALLBACK_PORT_UNAVAILABLE, message, cause);
    }
}
