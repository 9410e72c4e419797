package com.hilo.market.infra;

public class OutcomeUnavailableException extends RuntimeException {

    public OutcomeUnavailableException(String message) {
        super(message);
    }

    public OutcomeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
