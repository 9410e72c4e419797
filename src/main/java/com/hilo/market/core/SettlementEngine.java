package com.hilo.market.core;

import com.hilo.market.domain.MarketConfig;
import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.Round;
import com.hilo.market.domain.RoundOutcome;
import com.hilo.market.domain.RoundResult;
import com.hilo.market.domain.Side;
import com.hilo.market.domain.TransferFailedException;
import com.hilo.market.domain.event.RoundSettledEvent;
import com.hilo.market.infra.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;

/**
 * Turns one trusted outcome report into a frozen {@link RoundResult} and rotates the ledger to
 * the next round.
 *
 * <p>Everything is computed before any state is touched. The fee transfer to the treasury is the
 * only external call; if it fails nothing has been committed and the keeper can simply retry.
 */
@Slf4j
@RequiredArgsConstructor
public class SettlementEngine {

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(MarketConfig.MAX_FEE_BPS);

    private final MarketConfig config;
    private final RoundLedger ledger;
    private final AccessControl accessControl;
    private final ReentrancyGuard guard;
    private final TransferGateway transfers;
    private final ApplicationEventPublisher events;

    public RoundResult settle(String caller, long reportedOutcome, long now) {
        accessControl.requireKeeperOrOwner(caller);
        return guard.call("settle", () -> doSettle(reportedOutcome, now));
    }

    private RoundResult doSettle(long reportedOutcome, long now) {
        if (config.isPaused()) {
            throw MarketException.conflict("PAUSED", "Market is paused");
        }
        if (!WindowPolicy.settlementDue(now, ledger.getLastSettlement(), config.getSettlementInterval())) {
            throw MarketException.validation("TOO_EARLY", "Round " + ledger.currentRound().getNumber()
                    + " cannot be settled for another "
                    + ledger.timeUntilSettlement(now) + "s");
        }
        if (reportedOutcome < config.getOutcomeMin() || reportedOutcome > config.getOutcomeMax()) {
            throw MarketException.validation("OUTCOME_OUT_OF_RANGE", "Reported outcome " + reportedOutcome
                    + " outside " + config.getOutcomeMin() + ".." + config.getOutcomeMax());
        }

        Round round = ledger.currentRound();
        RoundResult result = evaluate(round, ledger.getRolloverPool(), reportedOutcome, config.getFeeBps(), now);

        if (result.getFee().signum() > 0) {
            ledger.requireAvailable(result.getFee());
            payTreasury(result.getFee());
            ledger.debit(result.getFee());
        }

        ledger.recordResult(result);
        log.info("Round {} settled: {} | reported={} baseline={} participants={} higher={} lower={} fee={} "
                + "distributable={} rollover={}",
                result.getRound(), result.getOutcome(), reportedOutcome, round.getBaseline(), round.participantCount(),
                result.getHigherPool(), result.getLowerPool(), result.getFee(), result.getDistributable(),
                result.getRolloverAfter());
        events.publishEvent(RoundSettledEvent.builder()
                .round(result.getRound())
                .reportedOutcome(reportedOutcome)
                .priorBaseline(round.getBaseline())
                .outcome(result.getOutcome())
                .winningSide(result.getWinningSide())
                .tie(result.isTie())
                .totalPot(result.totalStaked().add(ledger.getRolloverPool()))
                .fee(result.getFee())
                .build());

        ledger.advance(reportedOutcome, now, result.getRolloverAfter());
        return result;
    }

    private void payTreasury(BigInteger fee) {
        try {
            transfers.transfer(config.getTreasury(), fee);
        } catch (TransferFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Fee transfer to {} failed", config.getTreasury(), e);
            throw new TransferFailedException(config.getTreasury(), fee, e);
        }
    }

    /**
     * Classifies a round without side effects.
     *
     * <p>A round where nothing new was staked is NO_PARTICIPATION even if rollover is waiting:
     * with both pools empty there is no side that could receive it.
     */
    static RoundResult evaluate(Round round, BigInteger rollover, long reportedOutcome, int feeBps, long now) {
        BigInteger higher = round.getHigherPool();
        BigInteger lower = round.getLowerPool();
        BigInteger newStakes = higher.add(lower);
        BigInteger total = newStakes.add(rollover);

        RoundResult.RoundResultBuilder result = RoundResult.builder()
                .round(round.getNumber())
                .baseline(round.getBaseline())
                .reportedOutcome(reportedOutcome)
                .higherPool(higher)
                .lowerPool(lower)
                .settledAt(now)
                .fee(BigInteger.ZERO)
                .distributable(BigInteger.ZERO)
                .rolloverAfter(rollover);

        if (total.signum() == 0 || newStakes.signum() == 0) {
            return result.outcome(RoundOutcome.NO_PARTICIPATION).build();
        }
        if (higher.signum() == 0 || lower.signum() == 0) {
            return result.outcome(RoundOutcome.ONE_SIDED).distributable(newStakes).build();
        }
        if (reportedOutcome == round.getBaseline()) {
            return result.outcome(RoundOutcome.TIE).rolloverAfter(total).build();
        }

        Side winner = reportedOutcome > round.getBaseline() ? Side.HIGHER : Side.LOWER;
        BigInteger fee = newStakes.multiply(BigInteger.valueOf(feeBps)).divide(BPS_DENOMINATOR);
        return result.outcome(RoundOutcome.DECIDED)
                .winningSide(winner)
                .fee(fee)
                .distributable(total.subtract(fee))
                .rolloverAfter(BigInteger.ZERO)
                .build();
    }
}
