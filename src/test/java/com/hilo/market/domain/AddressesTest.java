package com.hilo.market.domain;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

import static org.junit.jupiter.api.Assertions.*;

class AddressesTest {

    @Test
    void testNormalizesToChecksumForm() throws Exception {
        ECKeyPair keyPair = Keys.createEcKeyPair();
        String address = Credentials.create(keyPair).getAddress();

        String normalized = Addresses.normalize(address);

        assertEquals(Keys.toChecksumAddress(address), normalized);
        assertEquals(normalized, Addresses.normalize(address.toLowerCase()));
        assertEquals(normalized, Addresses.normalize("0x" + address.substring(2).toUpperCase()));
    }

    @Test
    void testRejectsZeroAddress() {
        MarketException e = assertThrows(MarketException.class, () -> Addresses.normalize(Addresses.ZERO));
        assertEquals("ZERO_ADDRESS", e.getCode());
        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }

    @Test
    void testRejectsMalformedAddress() {
        assertEquals("INVALID_ADDRESS", assertThrows(MarketException.class,
                () -> Addresses.normalize("0x1234")).getCode());
        assertEquals("INVALID_ADDRESS", assertThrows(MarketException.class,
                () -> Addresses.normalize("not-an-address")).getCode());
        assertEquals("INVALID_ADDRESS", assertThrows(MarketException.class,
                () -> Addresses.normalize(null)).getCode());
    }

    @Test
    void testSameIgnoresCase() {
        String lower = "0xa11ce00000000000000000000000000000000001";
        assertTrue(Addresses.same(lower, Addresses.normalize(lower)));
        assertFalse(Addresses.same(lower, "0xb0b0000000000000000000000000000000000002"));
        assertFalse(Addresses.same(lower, null));
    }

    @Test
    void testSameIgnoresPrefix() {
        String checksummed = Addresses.normalize("0xa11ce00000000000000000000000000000000001");
        assertTrue(Addresses.same("a11ce00000000000000000000000000000000001", checksummed));
        assertFalse(Addresses.same("0x", checksummed));
    }
}
