package com.hilo.market.domain.event;

import com.hilo.market.domain.Side;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class BetPlacedEvent {
    long round;
    String participant;
    Side side;
    BigInteger amount;
    long baseline;
}
