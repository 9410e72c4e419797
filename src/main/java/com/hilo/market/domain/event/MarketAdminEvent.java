package com.hilo.market.domain.event;

import lombok.Builder;
import lombok.Value;

/**
 * Audit record for owner-initiated configuration and role changes.
 */
@Value
@Builder
public class MarketAdminEvent {

    public enum Action {
        PAUSED,
        UNPAUSED,
        KEEPER_UPDATED,
        TREASURY_UPDATED,
        MIN_BET_UPDATED,
        MAX_BET_UPDATED,
        FEE_UPDATED,
        TIMING_UPDATED,
        CLAIM_WINDOW_UPDATED,
        SAFE_MODE_UPDATED,
        OWNERSHIP_TRANSFERRED
    }

    Action action;
    String by;
    String previousValue;
    String newValue;
}
