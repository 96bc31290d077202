package com.idovenue.service;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic of the funding ledger. Every division truncates toward zero; dust
 * left over by truncation stays unallocated.
 */
public final class AllocationMath {

    public static final int MAX_BASIS_POINTS = 10_000;
    public static final BigInteger BASIS_POINTS_SCALE = BigInteger.valueOf(MAX_BASIS_POINTS);
    public static final BigInteger MULTIPLIER_SCALE = BigInteger.TEN.pow(8);

    private AllocationMath() {
    }

    /**
     * Sale tokens bought by {@code amount} of payment token: {@code amount * 10^decimals / price}.
     */
    public static BigInteger allocationFor(BigInteger amount, int idoTokenDecimals, BigInteger idoPrice) {
        return amount.multiply(BigInteger.TEN.pow(idoTokenDecimals)).divide(idoPrice);
    }

    public static BigInteger secondaryCap(BigInteger idoSize, int secondaryCapBps) {
        return idoSize.multiply(BigInteger.valueOf(secondaryCapBps)).divide(BASIS_POINTS_SCALE);
    }

    /**
     * Nominal raise when the whole inventory sells: {@code idoSize * price / 10^decimals}.
     */
    public static BigInteger totalGoalValue(BigInteger idoSize, BigInteger idoPrice, int idoTokenDecimals) {
        return idoSize.multiply(idoPrice).divide(BigInteger.TEN.pow(idoTokenDecimals));
    }

    /**
     * Sale tokens already sold for {@code fundedValue}; divides before scaling.
     */
    public static BigInteger soldEquivalent(BigInteger fundedValue, BigInteger idoPrice, int idoTokenDecimals) {
        return fundedValue.divide(idoPrice).multiply(BigInteger.TEN.pow(idoTokenDecimals));
    }

    public static BigInteger scaledMaxAllocation(BigInteger maxAlloc, BigInteger rankMultiplier, BigInteger specMultiplier) {
        return maxAlloc.multiply(rankMultiplier).multiply(specMultiplier).divide(MULTIPLIER_SCALE);
    }

    public static boolean isValidBasisPoints(int bps) {
        return bps >= 0 && bps <= MAX_BASIS_POINTS;
    }
}
