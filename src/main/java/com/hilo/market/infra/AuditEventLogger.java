package com.hilo.market.infra;

import com.hilo.market.domain.event.BetPlacedEvent;
import com.hilo.market.domain.event.FundsRescuedEvent;
import com.hilo.market.domain.event.MarketAdminEvent;
import com.hilo.market.domain.event.RoundSettledEvent;
import com.hilo.market.domain.event.WinningsClaimedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the market's audit trail to the {@code AUDIT} logger, one line per emitted event.
 */
@Slf4j(topic = "AUDIT")
@Component
public class AuditEventLogger {

    @EventListener
    public void onBetPlaced(BetPlacedEvent e) {
        log.info("BET round={} participant={} side={} amount={} baseline={}",
                e.getRound(), e.getParticipant(), e.getSide(), e.getAmount(), e.getBaseline());
    }

    @EventListener
    public void onRoundSettled(RoundSettledEvent e) {
        log.info("SETTLED round={} outcome={} reported={} baseline={} winner={} tie={} pot={} fee={}",
                e.getRound(), e.getOutcome(), e.getReportedOutcome(), e.getPriorBaseline(),
                e.getWinningSide(), e.isTie(), e.getTotalPot(), e.getFee());
    }

    @EventListener
    public void onWinningsClaimed(WinningsClaimedEvent e) {
        log.info("CLAIMED round={} participant={} amount={}", e.getRound(), e.getParticipant(), e.getAmount());
    }

    @EventListener
    public void onAdmin(MarketAdminEvent e) {
        log.info("ADMIN {} by={} {} -> {}", e.getAction(), e.getBy(), e.getPreviousValue(), e.getNewValue());
    }

    @EventListener
    public void onRescue(FundsRescuedEvent e) {
        log.warn("RESCUE recipient={} amount={} by={}", e.getRecipient(), e.getAmount(), e.getBy());
    }
}
