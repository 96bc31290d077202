package com.idovenue.service;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllocationMathTest {

    @Test
    void allocationFor_scalesByDecimalsAndDividesByPrice() {
        BigInteger allocation = AllocationMath.allocationFor(BigInteger.valueOf(1_000_000), 18, BigInteger.TWO);

        assertEquals(BigInteger.valueOf(5).multiply(BigInteger.TEN.pow(23)), allocation);
    }

    @Test
    void allocationFor_truncatesTowardZero() {
        BigInteger allocation = AllocationMath.allocationFor(BigInteger.TEN, 0, BigInteger.valueOf(3));

        assertEquals(BigInteger.valueOf(3), allocation);
    }

    @Test
    void secondaryCap_appliesBasisPointsWithTruncation() {
        assertEquals(BigInteger.valueOf(2_500), AllocationMath.secondaryCap(BigInteger.valueOf(10_000), 2_500));
        assertEquals(BigInteger.ZERO, AllocationMath.secondaryCap(BigInteger.valueOf(3), 3_333));
        assertEquals(BigInteger.valueOf(999), AllocationMath.secondaryCap(BigInteger.valueOf(999), 10_000));
    }

    @Test
    void totalGoalValue_convertsSaleSizeIntoPaymentUnits() {
        BigInteger size = BigInteger.valueOf(1_000).multiply(BigInteger.TEN.pow(18));

        assertEquals(BigInteger.valueOf(2_000), AllocationMath.totalGoalValue(size, BigInteger.TWO, 18));
    }

    @Test
    void soldEquivalent_dividesBeforeScaling() {
        // 7 / 2 truncates to 3 before the decimal scale is applied
        assertEquals(BigInteger.valueOf(3_000), AllocationMath.soldEquivalent(BigInteger.valueOf(7), BigInteger.TWO, 3));
    }

    @Test
    void scaledMaxAllocation_dividesByMultiplierScale() {
        BigInteger scaled = AllocationMath.scaledMaxAllocation(
                BigInteger.valueOf(1_000),
                BigInteger.valueOf(150_000_000),
                BigInteger.valueOf(2));

        assertEquals(BigInteger.valueOf(3_000), scaled);
    }

    @Test
    void isValidBasisPoints_acceptsZeroThroughTenThousand() {
        assertTrue(AllocationMath.isValidBasisPoints(0));
        assertTrue(AllocationMath.isValidBasisPoints(10_000));
        assertFalse(AllocationMath.isValidBasisPoints(10_001));
        assertFalse(AllocationMath.isValidBasisPoints(-1));
    }
}
