package com.lounge.advisor.exception;

/**
 * Raised when provider credentials cannot be loaded or a bearer token
 * cannot be obtained or is rejected.
 */
public class AuthenticationException extends LoungeAdvisorException {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.AUTH;
    }
}
