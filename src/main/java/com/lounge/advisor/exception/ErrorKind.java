package com.lounge.advisor.exception;

/**
 * Failure categories surfaced in the response envelope.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    AUTH,
    PROVIDER,
    INTERNAL
}
