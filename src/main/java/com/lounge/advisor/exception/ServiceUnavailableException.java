package com.lounge.advisor.exception;

public class ServiceUnavailableException extends ProviderException {
    public ServiceUnavailableException(String message) {
        super(503, message);
    }
}
