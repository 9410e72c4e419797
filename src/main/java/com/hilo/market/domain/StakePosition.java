package com.hilo.market.domain;

import lombok.Value;

import java.math.BigInteger;

/**
 * A participant's cumulative stake on each side of one round.
 */
@Value
public class StakePosition {

    public static final StakePosition EMPTY = new StakePosition(BigInteger.ZERO, BigInteger.ZERO);

    BigInteger higher;
    BigInteger lower;

    public BigInteger on(Side side) {
        return side == Side.HIGHER ? higher : lower;
    }

    public BigInteger total() {
        return higher.add(lower);
    }

    public StakePosition plus(Side side, BigInteger amount) {
        return side == Side.HIGHER
                ? new StakePosition(higher.add(amount), lower)
                : new StakePosition(higher, lower.add(amount));
    }
}
