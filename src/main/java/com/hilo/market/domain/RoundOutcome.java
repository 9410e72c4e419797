package com.hilo.market.domain;

/**
 * How a settled round was classified. Determines what (if anything) can be claimed for it.
 */
public enum RoundOutcome {
    NO_PARTICIPATION, // nothing staked this round
    ONE_SIDED, // only one pool had stake, full refunds
    TIE, // outcome equal to baseline, whole pot rolls over
    DECIDED // winners split the pot after fee
}
