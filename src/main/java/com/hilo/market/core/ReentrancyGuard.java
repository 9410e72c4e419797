package com.hilo.market.core;

import com.hilo.market.domain.MarketException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Scoped non-blocking lock around every code path that moves value out of the market. A nested
 * attempt (a transfer recipient calling back in) or a concurrent one fails immediately instead
 * of waiting.
 */
@Slf4j
public class ReentrancyGuard {

    private final AtomicBoolean entered = new AtomicBoolean(false);

    public <T> T call(String operation, Supplier<T> body) {
        if (!entered.compareAndSet(false, true)) {
            log.warn("Rejected reentrant call to {}", operation);
            throw MarketException.conflict("REENTRANT_CALL", "Reentrant call rejected: " + operation);
        }
        try {
            return body.get();
        } finally {
            entered.set(false);
        }
    }

    public void run(String operation, Runnable body) {
        call(operation, () -> {
            body.run();
            return null;
        });
    }

    public boolean isEntered() {
        return entered.get();
    }
}
