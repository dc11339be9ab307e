package com.reportpull.auth.assertion;

/**
 * The assertion could not be signed because the key material is missing or broken.
 * This is a configuration defect, so it is thrown rather than reported as a result.
 */
public class AssertionSigningException extends RuntimeException {

    public AssertionSigningException(String message) {
        super(message);
    }

    public AssertionSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
