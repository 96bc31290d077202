package com.idovenue.gateway;

import java.math.BigInteger;

/**
 * Moves tokens into and out of venue custody. Both calls are all-or-nothing and throw when
 * the source balance cannot cover the amount.
 */
public interface TokenTransferGateway {

    void pull(String token, String from, BigInteger amount);

    void push(String token, String to, BigInteger amount);
}
