package com.hilo.market.core;

import com.hilo.market.domain.ErrorKind;
import com.hilo.market.domain.MarketException;
import com.hilo.market.domain.MarketState;
import com.hilo.market.domain.RoundOutcome;
import com.hilo.market.domain.RoundResult;
import com.hilo.market.domain.Side;
import com.hilo.market.domain.event.BetPlacedEvent;
import com.hilo.market.domain.event.RoundSettledEvent;
import com.hilo.market.domain.event.WinningsClaimedEvent;
import com.hilo.market.infra.InMemoryTransferGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.hilo.market.core.MarketFixtures.*;
import static com.hilo.market.core.RoundLedgerTest.assertRejected;
import static org.junit.jupiter.api.Assertions.*;

class HiLoMarketTest {

    private MutableClock clock;
    private InMemoryTransferGateway gateway;
    private List<Object> events;
    private HiLoMarket market;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        gateway = new InMemoryTransferGateway();
        events = new ArrayList<>();
        market = new HiLoMarket(config(), BASELINE, gateway, events::add, clock);
    }

    @Test
    void testHigherWinsScenario() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        clock.advance(INTERVAL);

        RoundResult result = market.settle(KEEPER, 1450);

        assertEquals(RoundOutcome.DECIDED, result.getOutcome());
        assertEquals(wei(4), gateway.balanceOf(TREASURY));
        assertEquals(wei(196), market.claim(ALICE, 1));
        assertRejected("NOTHING_TO_CLAIM", ErrorKind.STATE_CONFLICT, () -> market.claim(BOB, 1));
        assertEquals(wei(196), gateway.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, gateway.balanceOf(BOB));
    }

    @Test
    void testTieScenario() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        clock.advance(INTERVAL);

        market.settle(KEEPER, BASELINE);

        assertEquals(wei(200), market.getMarketState().getRolloverPool());
        assertRejected("NOTHING_TO_CLAIM", ErrorKind.STATE_CONFLICT, () -> market.claim(ALICE, 1));
        assertRejected("NOTHING_TO_CLAIM", ErrorKind.STATE_CONFLICT, () -> market.claim(BOB, 1));
        assertEquals(BigInteger.ZERO, gateway.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, gateway.balanceOf(BOB));

        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        clock.advance(INTERVAL);
        RoundResult next = market.settle(KEEPER, 1300);

        assertEquals(wei(4), next.getFee());
        assertEquals(wei(396), market.claim(ALICE, 2));
    }

    @Test
    void testOneSidedScenario() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        clock.advance(INTERVAL);

        RoundResult result = market.settle(KEEPER, 1500);

        assertEquals(RoundOutcome.ONE_SIDED, result.getOutcome());
        assertEquals(BigInteger.ZERO, result.getFee());
        assertEquals(wei(100), market.claim(ALICE, 1));
        assertEquals(BigInteger.ZERO, gateway.balanceOf(TREASURY));
    }

    @Test
    void testOneSidedRoundLeavesRolloverWaiting() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        clock.advance(INTERVAL);
        market.settle(KEEPER, BASELINE);

        market.stake(CAROL, Side.LOWER, wei(30));
        clock.advance(INTERVAL);
        market.settle(KEEPER, 1100);

        assertEquals(wei(30), market.claim(CAROL, 2));
        assertEquals(wei(200), market.getMarketState().getRolloverPool());
        assertEquals(wei(200), market.getMarketState().getHeldBalance());
    }

    @Test
    void testBettingWindowBoundary() {
        clock.set(DEADLINE - 1);
        assertTrue(market.bettingOpen());
        assertEquals(1, market.timeUntilBettingCloses());
        market.stake(ALICE, Side.HIGHER, wei(10));

        clock.set(DEADLINE);
        assertFalse(market.bettingOpen());
        assertEquals(0, market.timeUntilBettingCloses());
        assertEquals(CUTOFF, market.timeUntilSettlement());
        assertRejected("BETTING_CLOSED", ErrorKind.VALIDATION, () -> market.stake(ALICE, Side.HIGHER, wei(10)));
        assertRejected("TOO_EARLY", ErrorKind.VALIDATION, () -> market.settle(KEEPER, 1300));
        assertFalse(market.settlementDue());

        clock.set(START + INTERVAL);
        assertTrue(market.settlementDue());
        assertEquals(0, market.timeUntilSettlement());
    }

    @Test
    void testConservationAcrossRounds() {
        BigInteger staked = BigInteger.ZERO;
        BigInteger paid = BigInteger.ZERO;

        // round 1: tie, everything rolls over
        market.stake(ALICE, Side.HIGHER, wei(70));
        market.stake(BOB, Side.LOWER, wei(30));
        staked = staked.add(wei(100));
        clock.advance(INTERVAL);
        market.settle(KEEPER, BASELINE);

        // round 2: three winners split stakes plus rollover, floor division leaves dust
        market.stake(ALICE, Side.HIGHER, wei(10));
        market.stake(BOB, Side.HIGHER, wei(10));
        market.stake(CAROL, Side.HIGHER, wei(13));
        market.stake(DAVE, Side.LOWER, wei(20));
        staked = staked.add(wei(53));
        clock.advance(INTERVAL);
        RoundResult decided = market.settle(KEEPER, 1400);

        assertEquals(wei(1), decided.getFee());
        assertEquals(wei(152), decided.getDistributable());
        for (String winner : List.of(ALICE, BOB, CAROL)) {
            paid = paid.add(market.claim(winner, 2));
        }
        assertRejected("NOTHING_TO_CLAIM", ErrorKind.STATE_CONFLICT, () -> market.claim(DAVE, 2));

        BigInteger fees = gateway.balanceOf(TREASURY);
        BigInteger dust = market.getMarketState().getHeldBalance();
        assertEquals(staked, paid.add(fees).add(dust));
        assertTrue(dust.compareTo(wei(3)) <= 0, "dust " + dust);
        assertEquals(BigInteger.ZERO, market.getMarketState().getRolloverPool());
        assertEquals(paid, gateway.balanceOf(ALICE).add(gateway.balanceOf(BOB)).add(gateway.balanceOf(CAROL)));
    }

    @Test
    void testEventsEmittedOncePerStateChange() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        assertRejected("BET_TOO_SMALL", ErrorKind.VALIDATION, () -> market.stake(BOB, Side.LOWER, wei(1)));
        clock.advance(INTERVAL);
        market.settle(KEEPER, 1450);
        market.claim(ALICE, 1);
        assertThrows(MarketException.class, () -> market.claim(ALICE, 1));

        assertEquals(2, events.stream().filter(e -> e instanceof BetPlacedEvent).count());
        assertEquals(1, events.stream().filter(e -> e instanceof RoundSettledEvent).count());
        assertEquals(1, events.stream().filter(e -> e instanceof WinningsClaimedEvent).count());
    }

    @Test
    void testMarketStateView() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(ALICE, Side.LOWER, wei(20));
        clock.advance(60);

        MarketState state = market.getMarketState();
        assertEquals(1, state.getRound());
        assertEquals(BASELINE, state.getBaseline());
        assertEquals(wei(100), state.getHigherPool());
        assertEquals(wei(20), state.getLowerPool());
        assertEquals(BigInteger.ZERO, state.getRolloverPool());
        assertEquals(wei(120), state.getHeldBalance());
        assertTrue(state.isBettingOpen());
        assertEquals(INTERVAL - CUTOFF - 60, state.getTimeUntilBettingCloses());
        assertEquals(INTERVAL - 60, state.getTimeUntilSettlement());
        assertFalse(state.isPaused());

        assertEquals(wei(100), market.getMyBet(ALICE).getHigher());
        assertEquals(wei(20), market.getMyBet(ALICE).getLower());
        assertEquals(BigInteger.ZERO, market.getMyBet(BOB).total());
    }

    @Test
    void testHistoricalBetsSurviveRotation() {
        market.stake(ALICE, Side.LOWER, wei(40));
        clock.advance(INTERVAL);
        market.settle(KEEPER, 1000);

        assertEquals(BigInteger.ZERO, market.getMyBet(ALICE).total());
        assertEquals(wei(40), market.getBet(1, ALICE).getLower());
        assertTrue(market.getRoundResult(1).isPresent());
        assertTrue(market.getRoundResult(2).isEmpty());
    }

    @Test
    void testDirectTransferRejected() {
        MarketException e = assertThrows(MarketException.class, () -> market.receive(ALICE, wei(100)));
        assertEquals("DIRECT_TRANSFER_REJECTED", e.getCode());
        assertEquals(BigInteger.ZERO, market.getMarketState().getHeldBalance());
    }

    @Test
    void testInvalidInitialBaselineRejected() {
        assertThrows(MarketException.class, () -> new HiLoMarket(config(), 9999, gateway, events::add, clock));
    }

    @Test
    void testUnfundedSettlementMovesNothing() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        market.pause(OWNER);
        market.rescue(OWNER, DAVE, wei(200));
        market.unpause(OWNER);
        clock.advance(INTERVAL);

        for (int attempt = 0; attempt < 3; attempt++) {
            assertRejected("INSUFFICIENT_BALANCE", ErrorKind.VALIDATION, () -> market.settle(KEEPER, 1450));
        }

        assertEquals(BigInteger.ZERO, gateway.balanceOf(TREASURY));
        assertEquals(1, market.getMarketState().getRound());
        assertTrue(market.getRoundResult(1).isEmpty());
        assertEquals(0, events.stream().filter(e -> e instanceof RoundSettledEvent).count());
    }

    @Test
    void testUnfundedClaimMovesNothing() {
        market.stake(ALICE, Side.HIGHER, wei(100));
        market.stake(BOB, Side.LOWER, wei(100));
        clock.advance(INTERVAL);
        market.settle(KEEPER, 1450);
        market.pause(OWNER);
        market.rescue(OWNER, DAVE, wei(100));

        assertRejected("INSUFFICIENT_BALANCE", ErrorKind.VALIDATION, () -> market.claim(ALICE, 1));

        assertEquals(BigInteger.ZERO, gateway.balanceOf(ALICE));
        assertFalse(market.hasClaimed(1, ALICE));
        assertEquals(wei(96), market.getMarketState().getHeldBalance());
        assertEquals(0, events.stream().filter(e -> e instanceof WinningsClaimedEvent).count());
    }
}
