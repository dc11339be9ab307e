package com.reportpull.auth.session;

import com.reportpull.auth.AuthErrorKind;
import com.reportpull.auth.AuthException;

/**
 * A session was requested for a context from a thread that context does not run on.
 */
public class SessionBindingException extends AuthException {

    public SessionBindingException(String message) {
        super(AuthErrorKind.SESSION_BINDING_ERROR, message);
    }
}
