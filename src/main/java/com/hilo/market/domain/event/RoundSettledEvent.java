package com.hilo.market.domain.event;

import com.hilo.market.domain.RoundOutcome;
import com.hilo.market.domain.Side;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class RoundSettledEvent {
    long round;
    long reportedOutcome;
    long priorBaseline;
    RoundOutcome outcome;
    Side winningSide; // null unless DECIDED
    boolean tie;
    BigInteger totalPot; // this round's stakes plus rollover
    BigInteger fee;
}
