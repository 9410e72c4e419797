package com.hilo.market.domain.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class WinningsClaimedEvent {
    long round;
    String participant;
    BigInteger amount;
}
