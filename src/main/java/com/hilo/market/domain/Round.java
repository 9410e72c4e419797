package com.hilo.market.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stake bookkeeping for one round. Mutated only while the round is current; after settlement
 * it is kept read-only so historical claims can look up individual stakes.
 */
@Getter
@ToString(exclude = "positions")
public class Round {

    private final long number;
    private final long baseline;
    private volatile BigInteger higherPool = BigInteger.ZERO;
    private volatile BigInteger lowerPool = BigInteger.ZERO;
    @Getter(AccessLevel.NONE)
    private final Map<String, StakePosition> positions = new ConcurrentHashMap<>();

    public Round(long number, long baseline) {
        this.number = number;
        this.baseline = baseline;
    }

    public void addStake(String participant, Side side, BigInteger amount) {
        positions.merge(participant, StakePosition.EMPTY.plus(side, amount),
                (current, ignored) -> current.plus(side, amount));
        if (side == Side.HIGHER) {
            higherPool = higherPool.add(amount);
        } else {
            lowerPool = lowerPool.add(amount);
        }
    }

    public StakePosition positionOf(String participant) {
        return positions.getOrDefault(participant, StakePosition.EMPTY);
    }

    public BigInteger pool(Side side) {
        return side == Side.HIGHER ? higherPool : lowerPool;
    }

    public BigInteger totalStaked() {
        return higherPool.add(lowerPool);
    }

    public int participantCount() {
        return positions.size();
    }
}
