package com.hilo.market.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Frozen snapshot of a settled round. Claims read this, never the live pools.
 */
@Value
@Builder
public class RoundResult {
    long round;
    RoundOutcome outcome;
    long baseline;
    long reportedOutcome;
    BigInteger higherPool;
    BigInteger lowerPool;
    Side winningSide; // only when DECIDED
    BigInteger fee;
    BigInteger distributable; // refund base when ONE_SIDED, winners' pot when DECIDED
    BigInteger rolloverAfter;
    long settledAt;

    public BigInteger pool(Side side) {
        return side == Side.HIGHER ? higherPool : lowerPool;
    }

    public BigInteger totalStaked() {
        return higherPool.add(lowerPool);
    }

    public boolean isTie() {
        return outcome == RoundOutcome.TIE;
    }
}
