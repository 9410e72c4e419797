package com.hilo.market.domain;

import java.math.BigInteger;

/**
 * Outbound value movement was rejected by the recipient, the treasury or the transport.
 */
public class TransferFailedException extends MarketException {

    public TransferFailedException(String recipient, BigInteger amount, String reason) {
        super(ErrorKind.TRANSFER_FAILURE, "TRANSFER_FAILED",
                "Transfer of " + amount + " to " + recipient + " failed: " + reason);
    }

    public TransferFailedException(String recipient, BigInteger amount, Throwable cause) {
        super(ErrorKind.TRANSFER_FAILURE, "TRANSFER_FAILED",
                "Transfer of " + amount + " to " + recipient + " failed: " + cause.getMessage(), cause);
    }
}
