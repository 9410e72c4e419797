package com.hilo.market.core;

import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.MarketConfig;
import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.RoundResult;
import com.hilo.market.domain.StakePosition;
import com.hilo.market.domain.TransferFailedException;
import com.hilo.market.domain.event.WinningsClaimedEvent;
import com.hilo.market.infra.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pull-based payouts. Each participant withdraws their own share of a settled round, at most
 * once, computed from the round's frozen {@link RoundResult}.
 */
@Slf4j
@RequiredArgsConstructor
public class ClaimEngine {

    private final MarketConfig config;
    private final RoundLedger ledger;
    private final ReentrancyGuard guard;
    private final TransferGateway transfers;
    private final ApplicationEventPublisher events;

    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public BigInteger claim(long round, String participant, long now) {
        String who = Addresses.normalize(participant);
        return guard.call("claim", () -> {
            BigInteger payout = payoutFor(round, who, now);
            ledger.requireAvailable(payout);

            // flag first so a recipient calling back in sees the claim as spent
            String key = key(round, who);
            claimed.add(key);
            try {
                transfers.transfer(who, payout);
            } catch (TransferFailedException e) {
                claimed.remove(key);
                log.warn("Claim for round {} by {} rolled back: {}", round, who, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                claimed.remove(key);
                log.warn("Claim for round {} by {} rolled back", round, who, e);
                throw new TransferFailedException(who, payout, e);
            }
            ledger.debit(payout);

            log.info("Round {}: {} claimed {}", round, who, payout);
            events.publishEvent(WinningsClaimedEvent.builder()
                    .round(round)
                    .participant(who)
                    .amount(payout)
                    .build());
            return payout;
        });
    }

    /**
     * What {@link #claim} would pay right now, or zero whenever it would fail.
     */
    public BigInteger claimable(long round, String participant, long now) {
        try {
            return payoutFor(round, Addresses.normalize(participant), now);
        } catch (MarketException e) {
            return BigInteger.ZERO;
        }
    }

    public boolean hasClaimed(long round, String participant) {
        return claimed.contains(key(round, Addresses.normalize(participant)));
    }

    private BigInteger payoutFor(long round, String who, long now) {
        RoundResult result = ledger.result(round)
                .orElseThrow(() -> MarketException.conflict("NOT_SETTLED", "Round " + round + " is not settled"));
        if (claimed.contains(key(round, who))) {
            throw MarketException.conflict("ALREADY_CLAIMED", who + " already claimed round " + round);
        }
        if (config.getClaimWindow() > 0 && now > result.getSettledAt() + config.getClaimWindow()) {
            throw MarketException.conflict("CLAIM_EXPIRED", "Claim window for round " + round + " has closed");
        }

        StakePosition position = ledger.positionOf(round, who);
        BigInteger payout;
        switch (result.getOutcome()) {
            case ONE_SIDED:
                payout = position.total();
                break;
            case DECIDED:
                BigInteger stake = position.on(result.getWinningSide());
                payout = stake.signum() == 0
                        ? BigInteger.ZERO
                        : stake.multiply(result.getDistributable()).divide(result.pool(result.getWinningSide()));
                break;
            default:
                payout = BigInteger.ZERO;
        }
        if (payout.signum() == 0) {
            throw MarketException.conflict("NOTHING_TO_CLAIM", who + " has nothing to claim for round " + round);
        }
        return payout;
    }

    private static String key(long round, String who) {
        return round + ":" + who;
    }
}
