package com.hilo.market.core;

import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.RoundResult;
import com.hilo.market.infra.OutcomeSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Optional;

/**
 * Keeper loop: once a round's interval has elapsed, read the outcome source and settle.
 * Failures are logged and picked up again on the next tick.
 */
@Slf4j
@RequiredArgsConstructor
public class SettlementKeeper {

    private final HiLoMarket market;
    private final OutcomeSource outcomeSource;
    private final String keeperAddress;

    @Scheduled(fixedDelayString = "${market.keeper-loop.poll-interval-millis:15000}")
    public void runLoop() {
        tick();
    }

    public Optional<RoundResult> tick() {
        if (market.getMarketState().isPaused()) {
            log.debug("[KEEPER] Market paused, skipping");
            return Optional.empty();
        }
        if (!market.settlementDue()) {
            log.debug("[KEEPER] Settlement due in {}s", market.timeUntilSettlement());
            return Optional.empty();
        }

        try {
            long outcome = outcomeSource.currentOutcome();
            log.info("[KEEPER] Settlement due, reported outcome {}", outcome);
            RoundResult result = market.settle(keeperAddress, outcome);
            log.info("[KEEPER] Round {} settled as {}", result.getRound(), result.getOutcome());
            return Optional.of(result);
        } catch (MarketException e) {
            log.error("[KEEPER] Settlement rejected ({}): {}", e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("[KEEPER] Settlement attempt failed", e);
        }
        return Optional.empty();
    }
}
