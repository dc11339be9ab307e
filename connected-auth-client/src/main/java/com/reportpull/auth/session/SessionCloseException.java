package com.reportpull.auth.session;

import java.util.List;

/**
 * One or more sessions failed to close. Each failure is attached as a suppressed exception.
 */
public class SessionCloseException extends RuntimeException {

    public SessionCloseException(List<? extends Throwable> failures) {
        super(failures.size() + " session(s) failed to close");
        failures.forEach(this::addSuppressed);
    }
}
