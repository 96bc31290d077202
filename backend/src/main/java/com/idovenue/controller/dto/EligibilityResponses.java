package com.idovenue.controller.dto;

import java.math.BigInteger;

public final class EligibilityResponses {

    private EligibilityResponses() {
    }

    /**
     * @param maxAllocation null when the round has no spec and allocation is unrestricted
     */
    public record RoundEligibility(
            Long roundId,
            Long metaIdoId,
            boolean registered,
            int rank,
            BigInteger multiplier,
            boolean eligible,
            BigInteger maxAllocation
    ) {
    }
}
