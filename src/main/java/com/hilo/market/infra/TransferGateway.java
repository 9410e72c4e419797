package com.hilo.market.infra;

import com.hilo.market.domain.TransferFailedException;

import java.math.BigInteger;

/**
 * Outbound value channel used for payouts, the protocol fee (treasury sink) and rescues.
 * Implementations may call recipient-controlled code and may fail.
 */
public interface TransferGateway {

    void transfer(String recipient, BigInteger amount) throws TransferFailedException;
}
