package com.hilo.market.domain;

public enum Side {
    HIGHER, LOWER
}
