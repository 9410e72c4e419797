package com.hilo.market.core;

import com.hilo.market.domain.MarketConfig;
import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.MarketState;
import com.hilo.market.domain.Round;
import com.hilo.market.domain.RoundResult;
import com.hilo.market.domain.Side;
import com.hilo.market.domain.StakePosition;
import com.hilo.market.infra.TransferGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Public face of one higher/lower market. Applies the wall clock and delegates to the ledger,
 * settlement, claim and admin components, which share one config, one reentrancy guard and one
 * transfer gateway.
 */
@Slf4j
public class HiLoMarket {

    private final MarketConfig config;
    private final Clock clock;
    private final RoundLedger ledger;
    private final SettlementEngine settlementEngine;
    private final ClaimEngine claimEngine;
    private final MarketAdmin admin;

    public HiLoMarket(MarketConfig config, long initialBaseline, TransferGateway transfers,
            ApplicationEventPublisher events, Clock clock) {
        config.validate();
        if (initialBaseline < config.getOutcomeMin() || initialBaseline > config.getOutcomeMax()) {
            throw MarketException.validation("OUTCOME_OUT_OF_RANGE",
                    "Initial baseline " + initialBaseline + " is outside the outcome range");
        }
        this.config = config;
        this.clock = clock;

        ReentrancyGuard guard = new ReentrancyGuard();
        AccessControl accessControl = new AccessControl(config);
        this.ledger = new RoundLedger(config, guard, events, initialBaseline, now());
        this.settlementEngine = new SettlementEngine(config, ledger, accessControl, guard, transfers, events);
        this.claimEngine = new ClaimEngine(config, ledger, guard, transfers, events);
        this.admin = new MarketAdmin(config, ledger, accessControl, guard, transfers, events);

        log.info("Market opened: round 1, baseline {}, interval {}s, cutoff {}s, fee {} bps",
                initialBaseline, config.getSettlementInterval(), config.getBettingCutoff(), config.getFeeBps());
    }

    // --- participants ---

    public void stake(String participant, Side side, BigInteger amount) {
        ledger.stake(participant, side, amount, now());
    }

    public BigInteger claim(String participant, long round) {
        return claimEngine.claim(round, participant, now());
    }

    /**
     * Value sent to the market outside of {@link #stake} is refused.
     */
    public void receive(String sender, BigInteger amount) {
        throw MarketException.validation("DIRECT_TRANSFER_REJECTED",
                "Direct transfer of " + amount + " from " + sender + " rejected, use stake");
    }

    // --- keeper ---

    public RoundResult settle(String caller, long reportedOutcome) {
        return settlementEngine.settle(caller, reportedOutcome, now());
    }

    public boolean settlementDue() {
        return WindowPolicy.settlementDue(now(), ledger.getLastSettlement(), config.getSettlementInterval());
    }

    // --- reads ---

    public boolean bettingOpen() {
        return ledger.bettingOpen(now());
    }

    public long timeUntilBettingCloses() {
        return ledger.timeUntilBettingCloses(now());
    }

    public long timeUntilSettlement() {
        return ledger.timeUntilSettlement(now());
    }

    public MarketState getMarketState() {
        long now = now();
        Round round = ledger.currentRound();
        return MarketState.builder()
                .round(round.getNumber())
                .baseline(round.getBaseline())
                .higherPool(round.getHigherPool())
                .lowerPool(round.getLowerPool())
                .rolloverPool(ledger.getRolloverPool())
                .heldBalance(ledger.getHeldBalance())
                .bettingOpen(ledger.bettingOpen(now))
                .timeUntilBettingCloses(ledger.timeUntilBettingCloses(now))
                .timeUntilSettlement(ledger.timeUntilSettlement(now))
                .lastSettlement(ledger.getLastSettlement())
                .paused(config.isPaused())
                .safeMode(config.isSafeMode())
                .build();
    }

    public StakePosition getMyBet(String participant) {
        return ledger.positionOf(ledger.currentRound().getNumber(), participant);
    }

    public StakePosition getBet(long round, String participant) {
        return ledger.positionOf(round, participant);
    }

    public Optional<RoundResult> getRoundResult(long round) {
        return ledger.result(round);
    }

    public BigInteger claimable(long round, String participant) {
        return claimEngine.claimable(round, participant, now());
    }

    public boolean hasClaimed(long round, String participant) {
        return claimEngine.hasClaimed(round, participant);
    }

    public MarketConfig getConfig() {
        return config.toBuilder().build();
    }

    // --- owner ---

    public void pause(String caller) {
        admin.pause(caller);
    }

    public void unpause(String caller) {
        admin.unpause(caller);
    }

    public void setKeeper(String caller, String keeper) {
        admin.setKeeper(caller, keeper);
    }

    public void setTreasury(String caller, String treasury) {
        admin.setTreasury(caller, treasury);
    }

    public void setMinBet(String caller, BigInteger minBet) {
        admin.setMinBet(caller, minBet);
    }

    public void setMaxBet(String caller, BigInteger maxBet) {
        admin.setMaxBet(caller, maxBet);
    }

    public void setFeeBps(String caller, int feeBps) {
        admin.setFeeBps(caller, feeBps);
    }

    public void setTiming(String caller, long settlementInterval, long bettingCutoff) {
        admin.setTiming(caller, settlementInterval, bettingCutoff);
    }

    public void setClaimWindow(String caller, long claimWindow) {
        admin.setClaimWindow(caller, claimWindow);
    }

    public void setSafeMode(String caller, boolean safeMode) {
        admin.setSafeMode(caller, safeMode);
    }

    public void transferOwnership(String caller, String newOwner) {
        admin.transferOwnership(caller, newOwner);
    }

    public void rescue(String caller, String recipient, BigInteger amount) {
        admin.rescue(caller, recipient, amount);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
