package com.hilo.market.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Read-only view of the live market, as returned by {@code getMarketState()}.
 */
@Value
@Builder
public class MarketState {
    long round;
    long baseline;
    BigInteger higherPool;
    BigInteger lowerPool;
    BigInteger rolloverPool;
    BigInteger heldBalance;
    boolean bettingOpen;
    long timeUntilBettingCloses;
    long timeUntilSettlement;
    long lastSettlement;
    boolean paused;
    boolean safeMode;
}
