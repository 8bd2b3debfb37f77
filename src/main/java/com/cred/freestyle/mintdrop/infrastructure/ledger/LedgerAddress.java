package com.cred.freestyle.mintdrop.infrastructure.ledger;

import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

/**
 * Ledger account addresses: base58 text over a 32-byte public key.
 *
 * @author Mint Drop Team
 */
public final class LedgerAddress {

    public static final int PUBLIC_KEY_LENGTH = 32;

    private LedgerAddress() {
    }

    /**
     * Canonical binary form of an address.
     *
     * @param address base58 address
     * @return the 32-byte public key
     * @throws IllegalArgumentException if the text is not base58 or does not decode to 32 bytes
     */
    public static byte[] decode(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is blank");
        }
        byte[] bytes;
        try {
            bytes = Base58.decode(address.trim());
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("Address is not valid base58: " + address, e);
        }
        if (bytes.length != PUBLIC_KEY_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "Address %s decodes to %d bytes, expected %d", address, bytes.length, PUBLIC_KEY_LENGTH));
        }
        return bytes;
    }

    public static boolean isValid(String address) {
        try {
            decode(address);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static String encode(byte[] publicKey) {
        return Base58.encode(publicKey);
    }
}
