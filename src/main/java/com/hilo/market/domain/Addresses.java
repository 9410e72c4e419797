package com.hilo.market.domain;

import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Participant and role identities are 20-byte EVM addresses, kept in EIP-55 checksum form so
 * that differently cased spellings of one address map to the same ledger entry.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private Addresses() {
    }

    public static String normalize(String address) {
        if (address == null || !WalletUtils.isValidAddress(address)) {
            throw MarketException.validation("INVALID_ADDRESS", "Not a valid address: " + address);
        }
        String prefixed = Numeric.prependHexPrefix(address);
        if (Numeric.toBigInt(prefixed).equals(BigInteger.ZERO)) {
            throw MarketException.validation("ZERO_ADDRESS", "The zero address is not allowed");
        }
        return Keys.toChecksumAddress(prefixed);
    }

    /**
     * Compares two addresses ignoring case and the optional {@code 0x} prefix. Never throws, so
     * malformed callers simply fail the comparison.
     */
    public static boolean same(String a, String b) {
        return a != null && b != null && Numeric.cleanHexPrefix(a).equalsIgnoreCase(Numeric.cleanHexPrefix(b));
    }
}
