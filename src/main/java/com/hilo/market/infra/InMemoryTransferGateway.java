package com.hilo.market.infra;

import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.TransferFailedException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credits payouts to an internal balance book. Used when the market runs without a chain, and
 * lets recipients be blocked to exercise the failure paths.
 */
@Slf4j
public class InMemoryTransferGateway implements TransferGateway {

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();

    @Override
    public void transfer(String recipient, BigInteger amount) {
        String to = Addresses.normalize(recipient);
        if (amount == null || amount.signum() <= 0) {
            throw new TransferFailedException(to, amount, "amount must be positive");
        }
        if (blocked.contains(to)) {
            throw new TransferFailedException(to, amount, "recipient rejected the transfer");
        }
        balances.merge(to, amount, BigInteger::add);
        log.info("[TRANSFER] Credited {} to {}", amount, to);
    }

    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(Addresses.normalize(account), BigInteger.ZERO);
    }

    public void block(String account) {
        blocked.add(Addresses.normalize(account));
    }

    public void unblock(String account) {
        blocked.remove(Addresses.normalize(account));
    }
}
