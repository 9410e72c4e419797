package com.hilo.market.domain.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class FundsRescuedEvent {
    String recipient;
    BigInteger amount;
    String by;
}
