package com.hilo.market.core;

import com.hilo.market.domain.ErrorKind;
import com.hilo.market.domain.MarketException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReentrancyGuardTest {

    private final ReentrancyGuard guard = new ReentrancyGuard();

    @Test
    void testNestedCallRejected() {
        MarketException nested = assertThrows(MarketException.class,
                () -> guard.run("outer", () -> guard.run("inner", () -> fail("inner body must not run"))));

        assertEquals(ErrorKind.STATE_CONFLICT, nested.getKind());
        assertEquals("REENTRANT_CALL", nested.getCode());
        assertFalse(guard.isEntered());
    }

    @Test
    void testReleasedAfterFailure() {
        assertThrows(IllegalStateException.class, () -> guard.run("failing", () -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(guard.isEntered());
        Integer next = guard.call("next", () -> 42);
        assertEquals(42, next.intValue());
    }

    @Test
    void testHeldWhileBodyRuns() {
        guard.run("body", () -> assertTrue(guard.isEntered()));
        assertFalse(guard.isEntered());
    }
}
