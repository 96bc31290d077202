package com.idovenue.service;

import com.idovenue.web.IdoVenueException;

import java.util.Locale;

/**
 * Canonical form for wallet and token addresses used as ledger keys.
 */
public final class WalletAddresses {

    private WalletAddresses() {
    }

    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw IdoVenueException.invalidAddress("Address must not be blank");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
