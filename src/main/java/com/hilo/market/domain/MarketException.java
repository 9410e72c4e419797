package com.hilo.market.domain;

import lombok.Getter;

/**
 * Every rejected market operation surfaces as one of these. The operation that threw it has
 * left no state behind.
 */
@Getter
public class MarketException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public MarketException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public MarketException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static MarketException validation(String code, String message) {
        return new MarketException(ErrorKind.VALIDATION, code, message);
    }

    public static MarketException unauthorized(String code, String message) {
        return new MarketException(ErrorKind.AUTHORIZATION, code, message);
    }

    public static MarketException conflict(String code, String message) {
        return new MarketException(ErrorKind.STATE_CONFLICT, code, message);
    }

    @Override
    public String toString() {
        return "MarketException[" + kind + "/" + code + "]: " + getMessage();
    }
}
