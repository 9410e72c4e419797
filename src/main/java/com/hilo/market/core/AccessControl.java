package com.hilo.market.core;

import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.MarketConfig;
import com.hilo.market.domain.MarketException;
import lombok.RequiredArgsConstructor;

/**
 * Role checks for privileged operations. The owner holds every privilege; the keeper may only
 * settle rounds.
 */
@RequiredArgsConstructor
public class AccessControl {

    private final MarketConfig config;

    public boolean isOwner(String caller) {
        return Addresses.same(caller, config.getOwner());
    }

    public boolean isKeeper(String caller) {
        return Addresses.same(caller, config.getKeeper());
    }

    public void requireOwner(String caller) {
        if (!isOwner(caller)) {
            throw MarketException.unauthorized("NOT_OWNER", "Caller " + caller + " is not the owner");
        }
    }

    public void requireKeeperOrOwner(String caller) {
        if (!isKeeper(caller) && !isOwner(caller)) {
            throw MarketException.unauthorized("NOT_KEEPER", "Caller " + caller + " is neither keeper nor owner");
        }
    }
}
