package com.lounge.advisor.exception;

public class SecretNotFoundException extends AuthenticationException {
    public SecretNotFoundException(String message) {
        super(message);
    }
}
