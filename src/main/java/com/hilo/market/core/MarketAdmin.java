package com.hilo.market.core;

import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.MarketConfig;
import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.event.FundsRescuedEvent;
import com.hilo.market.domain.event.MarketAdminEvent;
import com.hilo.market.domain.event.MarketAdminEvent.Action;
import com.hilo.market.infra.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owner-only configuration, pause control and emergency rescue. Every change is validated on a
 * copy of the config first and published as a {@link MarketAdminEvent}.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketAdmin {

    private final MarketConfig config;
    private final RoundLedger ledger;
    private final AccessControl accessControl;
    private final ReentrancyGuard guard;
    private final TransferGateway transfers;
    private final ApplicationEventPublisher events;

    public void pause(String caller) {
        if (config.isPaused()) {
            accessControl.requireOwner(caller);
            throw MarketException.conflict("ALREADY_PAUSED", "Market is already paused");
        }
        update(caller, Action.PAUSED, MarketConfig::isPaused, c -> c.setPaused(true));
    }

    public void unpause(String caller) {
        if (!config.isPaused()) {
            accessControl.requireOwner(caller);
            throw MarketException.conflict("NOT_PAUSED", "Market is not paused");
        }
        update(caller, Action.UNPAUSED, MarketConfig::isPaused, c -> c.setPaused(false));
    }

    public void setKeeper(String caller, String keeper) {
        String normalized = Addresses.normalize(keeper);
        update(caller, Action.KEEPER_UPDATED, MarketConfig::getKeeper, c -> c.setKeeper(normalized));
    }

    public void setTreasury(String caller, String treasury) {
        String normalized = Addresses.normalize(treasury);
        update(caller, Action.TREASURY_UPDATED, MarketConfig::getTreasury, c -> c.setTreasury(normalized));
    }

    public void transferOwnership(String caller, String newOwner) {
        String normalized = Addresses.normalize(newOwner);
        update(caller, Action.OWNERSHIP_TRANSFERRED, MarketConfig::getOwner, c -> c.setOwner(normalized));
    }

    public void setMinBet(String caller, BigInteger minBet) {
        update(caller, Action.MIN_BET_UPDATED, MarketConfig::getMinBet, c -> c.setMinBet(minBet));
    }

    public void setMaxBet(String caller, BigInteger maxBet) {
        update(caller, Action.MAX_BET_UPDATED, MarketConfig::getMaxBet, c -> c.setMaxBet(maxBet));
    }

    public void setFeeBps(String caller, int feeBps) {
        update(caller, Action.FEE_UPDATED, MarketConfig::getFeeBps, c -> c.setFeeBps(feeBps));
    }

    public void setTiming(String caller, long settlementInterval, long bettingCutoff) {
        update(caller, Action.TIMING_UPDATED,
                c -> c.getSettlementInterval() + "/" + c.getBettingCutoff(),
                c -> {
                    c.setSettlementInterval(settlementInterval);
                    c.setBettingCutoff(bettingCutoff);
                });
    }

    public void setClaimWindow(String caller, long claimWindow) {
        update(caller, Action.CLAIM_WINDOW_UPDATED, MarketConfig::getClaimWindow, c -> c.setClaimWindow(claimWindow));
    }

    public void setSafeMode(String caller, boolean safeMode) {
        update(caller, Action.SAFE_MODE_UPDATED, MarketConfig::isSafeMode, c -> c.setSafeMode(safeMode));
    }

    /**
     * Last-resort recovery of held value. Only available while the market is paused.
     */
    public void rescue(String caller, String recipient, BigInteger amount) {
        accessControl.requireOwner(caller);
        String to = Addresses.normalize(recipient);
        guard.run("rescue", () -> {
            if (!config.isPaused()) {
                throw MarketException.conflict("NOT_PAUSED", "Rescue is only available while paused");
            }
            if (amount == null || amount.signum() <= 0 || amount.compareTo(ledger.getHeldBalance()) > 0) {
                throw MarketException.validation("INVALID_RESCUE_AMOUNT",
                        "Rescue amount " + amount + " must be within 1.." + ledger.getHeldBalance());
            }
            transfers.transfer(to, amount);
            ledger.debit(amount);

            log.warn("Rescued {} to {} by {}", amount, to, caller);
            events.publishEvent(FundsRescuedEvent.builder()
                    .recipient(to)
                    .amount(amount)
                    .by(caller)
                    .build());
        });
    }

    private void update(String caller, Action action, Function<MarketConfig, Object> field,
            Consumer<MarketConfig> change) {
        accessControl.requireOwner(caller);
        guard.run(action.name(), () -> {
            MarketConfig candidate = config.toBuilder().build();
            change.accept(candidate);
            candidate.validate();

            String previous = Objects.toString(field.apply(config));
            change.accept(config);
            String current = Objects.toString(field.apply(config));

            log.info("Config {} by {}: {} -> {}", action, caller, previous, current);
            events.publishEvent(MarketAdminEvent.builder()
                    .action(action)
                    .by(caller)
                    .previousValue(previous)
                    .newValue(current)
                    .build());
        });
    }
}
