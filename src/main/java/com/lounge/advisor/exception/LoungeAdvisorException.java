package com.lounge.advisor.exception;

/**
 * Base type for every failure the advisor reports with a known category.
 * Anything outside this hierarchy is reported as {@link ErrorKind#INTERNAL}.
 */
public abstract class LoungeAdvisorException extends RuntimeException {

    protected LoungeAdvisorException(String message) {
        super(message);
    }

    protected LoungeAdvisorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
