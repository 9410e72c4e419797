package com.hilo.market.infra;

/**
 * Trusted channel supplying the value a round settles against, fixed-point with 2 implied
 * decimals. No verification happens on this side.
 */
public interface OutcomeSource {

    long currentOutcome();
}
