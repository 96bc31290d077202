package com.idovenue.event;

import java.math.BigInteger;
import java.time.OffsetDateTime;

/**
 * Application events published by the venue. Listeners observe them after the emitting
 * transaction commits; nothing inside the venue consumes them.
 */
public final class IdoEvents {

    private IdoEvents() {
    }

    public record RoundCreated(
            long roundId,
            String idoToken,
            int idoTokenDecimals,
            String primaryToken,
            String secondaryToken,
            BigInteger idoPrice,
            BigInteger idoSize,
            BigInteger minimumFundingGoal,
            int secondaryCapBps,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            OffsetDateTime claimableTime,
            boolean whitelistEnabled
    ) {
    }

    public record RoundFinalized(
            long roundId,
            BigInteger idoSize,
            BigInteger fundedUsdValue
    ) {
    }

    public record ParticipationRecorded(
            long roundId,
            String participant,
            String token,
            BigInteger amount,
            BigInteger allocation
    ) {
    }

    public record Claimed(
            long roundId,
            String participant,
            BigInteger amount,
            BigInteger secondaryAmount,
            BigInteger tokenAllocation
    ) {
    }

    public record ClaimableTimeDelayed(
            long roundId,
            OffsetDateTime previousClaimableTime,
            OffsetDateTime claimableTime
    ) {
    }

    public record EndTimeDelayed(
            long roundId,
            OffsetDateTime previousEndTime,
            OffsetDateTime endTime
    ) {
    }

    public record WhitelistStatusChanged(
            long roundId,
            boolean enabled
    ) {
    }

    public record BasisPointsChanged(
            long roundId,
            int secondaryCapBps
    ) {
    }

    public record SpareTokensWithdrawn(
            long roundId,
            String recipient,
            BigInteger amount
    ) {
    }

    public record MetaIdoCreated(
            long metaIdoId
    ) {
    }

    public record MetaIdoMembershipChanged(
            long metaIdoId,
            long roundId,
            boolean added
    ) {
    }
}
