package com.hilo.market.domain;

public enum ErrorKind {
    VALIDATION,
    AUTHORIZATION,
    STATE_CONFLICT,
    TRANSFER_FAILURE
}
