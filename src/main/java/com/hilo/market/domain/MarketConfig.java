package com.hilo.market.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;

/**
 * Market-wide settings. One instance per market; mutated only through the owner setters in
 * {@code MarketAdmin}, which validate a candidate copy before applying it.
 */
@Data
@Builder(toBuilder = true)
public class MarketConfig {

    public static final int MAX_FEE_BPS = 10_000;

    private String owner;
    private String keeper;
    private String treasury;

    private BigInteger minBet;
    @Builder.Default
    private BigInteger maxBet = BigInteger.ZERO; // 0 = unlimited

    private long settlementInterval; // seconds
    private long bettingCutoff; // seconds before settlement when staking closes
    private int feeBps;

    // fixed-point, 2 implied decimals
    private long outcomeMin;
    private long outcomeMax;

    private long claimWindow; // seconds after settlement, 0 = never expires

    private boolean paused;
    private boolean safeMode;

    public boolean hasMaxBet() {
        return maxBet.signum() > 0;
    }

    /**
     * Staking is halted either by pause or by safe-mode wind-down.
     */
    public boolean stakingHalted() {
        return paused || safeMode;
    }

    public void validate() {
        if (minBet == null || minBet.signum() <= 0) {
            throw MarketException.validation("INVALID_MIN_BET", "Minimum bet must be positive");
        }
        if (maxBet == null || maxBet.signum() < 0) {
            throw MarketException.validation("INVALID_MAX_BET", "Maximum bet must be zero or positive");
        }
        if (hasMaxBet() && minBet.compareTo(maxBet) > 0) {
            throw MarketException.validation("MIN_ABOVE_MAX",
                    "Minimum bet " + minBet + " exceeds maximum bet " + maxBet);
        }
        if (feeBps < 0 || feeBps > MAX_FEE_BPS) {
            throw MarketException.validation("INVALID_FEE", "Fee must be within 0.." + MAX_FEE_BPS + " bps");
        }
        if (settlementInterval <= 0) {
            throw MarketException.validation("INVALID_INTERVAL", "Settlement interval must be positive");
        }
        if (bettingCutoff < 0 || bettingCutoff > settlementInterval) {
            throw MarketException.validation("INVALID_CUTOFF",
                    "Betting cutoff must be within 0.." + settlementInterval + " seconds");
        }
        if (outcomeMin >= outcomeMax) {
            throw MarketException.validation("INVALID_OUTCOME_RANGE", "Outcome min must be below outcome max");
        }
        if (claimWindow < 0) {
            throw MarketException.validation("INVALID_CLAIM_WINDOW", "Claim window must not be negative");
        }
        if (owner == null || keeper == null || treasury == null) {
            throw MarketException.validation("MISSING_ROLE", "Owner, keeper and treasury are required");
        }
    }
}
