package com.hilo.market.core;

import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.MarketConfig;
import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.Round;
import com.hilo.market.domain.RoundResult;
import com.hilo.market.domain.Side;
import com.hilo.market.domain.StakePosition;
import com.hilo.market.domain.event.BetPlacedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the stake bookkeeping of every round, the frozen results of settled rounds, the
 * rollover pool and the total value the market holds.
 *
 * <p>Only the current round accepts stakes. Settlement records a {@link RoundResult} first and
 * then {@link #advance advances} to a fresh round; earlier rounds stay readable for claims.
 */
@Slf4j
public class RoundLedger {

    private final MarketConfig config;
    private final ReentrancyGuard guard;
    private final ApplicationEventPublisher events;

    private final Map<Long, Round> rounds = new ConcurrentHashMap<>();
    private final Map<Long, RoundResult> results = new ConcurrentHashMap<>();

    private volatile Round current;
    private volatile long lastSettlement;
    private volatile BigInteger rolloverPool = BigInteger.ZERO;
    private volatile BigInteger heldBalance = BigInteger.ZERO;

    public RoundLedger(MarketConfig config, ReentrancyGuard guard, ApplicationEventPublisher events,
            long initialBaseline, long openedAt) {
        this.config = config;
        this.guard = guard;
        this.events = events;
        this.lastSettlement = openedAt;
        openRound(1, initialBaseline);
    }

    public void stake(String participant, Side side, BigInteger amount, long now) {
        String who = Addresses.normalize(participant);
        if (side == null) {
            throw MarketException.validation("MISSING_SIDE", "A side must be chosen");
        }
        guard.run("stake", () -> {
            if (config.isPaused()) {
                throw MarketException.conflict("PAUSED", "Market is paused");
            }
            if (config.isSafeMode()) {
                throw MarketException.conflict("SAFE_MODE", "Market is winding down, new stakes are not accepted");
            }
            if (amount == null || amount.compareTo(config.getMinBet()) < 0) {
                throw MarketException.validation("BET_TOO_SMALL",
                        "Stake " + amount + " is below the minimum of " + config.getMinBet());
            }
            if (config.hasMaxBet() && amount.compareTo(config.getMaxBet()) > 0) {
                throw MarketException.validation("BET_TOO_LARGE",
                        "Stake " + amount + " is above the maximum of " + config.getMaxBet());
            }
            if (!bettingOpen(now)) {
                throw MarketException.validation("BETTING_CLOSED",
                        "Betting for round " + current.getNumber() + " is closed");
            }

            Round round = current;
            round.addStake(who, side, amount);
            heldBalance = heldBalance.add(amount);

            log.info("Round {}: {} staked {} on {} (baseline {})",
                    round.getNumber(), who, amount, side, round.getBaseline());
            events.publishEvent(BetPlacedEvent.builder()
                    .round(round.getNumber())
                    .participant(who)
                    .side(side)
                    .amount(amount)
                    .baseline(round.getBaseline())
                    .build());
        });
    }

    public boolean bettingOpen(long now) {
        return WindowPolicy.bettingOpen(now, lastSettlement, config.getSettlementInterval(),
                config.getBettingCutoff(), config.stakingHalted());
    }

    public long timeUntilBettingCloses(long now) {
        return WindowPolicy.timeUntilBettingCloses(now, lastSettlement, config.getSettlementInterval(),
                config.getBettingCutoff(), config.stakingHalted());
    }

    public long timeUntilSettlement(long now) {
        return WindowPolicy.timeUntilSettlement(now, lastSettlement, config.getSettlementInterval());
    }

    public Round currentRound() {
        return current;
    }

    public Optional<RoundResult> result(long round) {
        return Optional.ofNullable(results.get(round));
    }

    public StakePosition positionOf(long round, String participant) {
        Round r = rounds.get(round);
        return r == null ? StakePosition.EMPTY : r.positionOf(Addresses.normalize(participant));
    }

    public long getLastSettlement() {
        return lastSettlement;
    }

    public BigInteger getRolloverPool() {
        return rolloverPool;
    }

    public BigInteger getHeldBalance() {
        return heldBalance;
    }

    void recordResult(RoundResult result) {
        if (results.putIfAbsent(result.getRound(), result) != null) {
            throw MarketException.conflict("ALREADY_SETTLED", "Round " + result.getRound() + " already settled");
        }
    }

    /**
     * Seals the current round and opens the next one. Must only run after the current round's
     * result has been recorded.
     */
    void advance(long newBaseline, long settledAt, BigInteger rolloverAfter) {
        long number = current.getNumber();
        if (!results.containsKey(number)) {
            throw new IllegalStateException("Round " + number + " has no recorded result");
        }
        rolloverPool = rolloverAfter;
        lastSettlement = settledAt;
        openRound(number + 1, newBaseline);
    }

    /**
     * Checked before any outbound transfer so that a payout the market cannot cover fails
     * without moving value.
     */
    void requireAvailable(BigInteger amount) {
        if (amount.signum() < 0 || amount.compareTo(heldBalance) > 0) {
            throw MarketException.validation("INSUFFICIENT_BALANCE",
                    "Cannot release " + amount + ", market holds " + heldBalance);
        }
    }

    void debit(BigInteger amount) {
        requireAvailable(amount);
        heldBalance = heldBalance.subtract(amount);
    }

    private void openRound(long number, long baseline) {
        Round round = new Round(number, baseline);
        rounds.put(number, round);
        current = round;
    }
}
