package com.lounge.advisor.exception;

/**
 * Raised when the flight data provider answers with a non-success status,
 * cannot be reached, or returns a payload that cannot be read.
 * The status code is null for transport failures and unreadable payloads.
 */
public class ProviderException extends LoungeAdvisorException {

    private final Integer statusCode;

    public ProviderException(Integer statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Server-side, transport and payload failures count against the provider circuit breaker.
     * Client errors (4xx) do not.
     */
    public boolean isProviderFault() {
        return statusCode == null || statusCode >= 500;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PROVIDER;
    }
}
