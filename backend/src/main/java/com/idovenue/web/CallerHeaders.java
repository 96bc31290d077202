package com.idovenue.web;

/**
 * Request headers identifying the calling wallet.
 */
public final class CallerHeaders {

    public static final String WALLET_ADDRESS = "X-Wallet-Address";

    private CallerHeaders() {
    }
}
