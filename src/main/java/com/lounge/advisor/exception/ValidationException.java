package com.lounge.advisor.exception;

public class ValidationException extends LoungeAdvisorException {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
