package com.idovenue.gateway;

import java.math.BigInteger;

public interface TokenMetadataGateway {

    int decimals(String token);

    BigInteger balanceOf(String holder, String token);
}
