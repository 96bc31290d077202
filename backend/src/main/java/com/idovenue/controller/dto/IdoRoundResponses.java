package com.idovenue.controller.dto;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.List;

public final class IdoRoundResponses {

    private IdoRoundResponses() {
    }

    public record RoundSummary(
            Long roundId,
            String idoToken,
            BigInteger idoPrice,
            BigInteger idoSize,
            BigInteger fundedUsdValue,
            Long parentMetaIdoId,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            OffsetDateTime claimableTime,
            boolean finalized,
            boolean whitelistEnabled
    ) {
    }

    public record RoundDetail(
            Long roundId,
            String idoToken,
            int idoTokenDecimals,
            String primaryToken,
            String secondaryToken,
            BigInteger idoPrice,
            BigInteger idoSize,
            BigInteger minimumFundingGoal,
            BigInteger fundedUsdValue,
            int secondaryCapBps,
            Long parentMetaIdoId,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            OffsetDateTime initialEndTime,
            OffsetDateTime claimableTime,
            OffsetDateTime initialClaimableTime,
            boolean finalized,
            boolean whitelistEnabled,
            boolean spareWithdrawn,
            List<TokenFunding> funding,
            RoundSpec spec,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record TokenFunding(
            String token,
            BigInteger totalFunded
    ) {
    }

    public record RoundSpec(
            boolean specsInitialized,
            int minRank,
            int maxRank,
            boolean noRank,
            BigInteger maxAlloc,
            BigInteger maxAllocMultiplier,
            boolean noMultiplier
    ) {
    }

    public record Position(
            Long roundId,
            String walletAddress,
            BigInteger amount,
            BigInteger secondaryAmount,
            BigInteger tokenAllocation
    ) {
    }

    public record ParticipationReceipt(
            Long roundId,
            String walletAddress,
            String token,
            BigInteger amount,
            BigInteger allocation,
            Position position
    ) {
    }

    public record ClaimReceipt(
            Long roundId,
            String walletAddress,
            BigInteger primaryAmount,
            BigInteger secondaryAmount,
            BigInteger tokenAllocation
    ) {
    }

    public record SpareWithdrawal(
            Long roundId,
            String recipient,
            BigInteger amount
    ) {
    }

    public record InventoryBalance(
            Long roundId,
            BigInteger deposited,
            BigInteger custodyBalance
    ) {
    }

    public record WhitelistUpdate(
            Long roundId,
            boolean added,
            int changed
    ) {
    }

    public record WhitelistStatus(
            Long roundId,
            String walletAddress,
            boolean whitelisted
    ) {
    }

    public record ParticipantSummary(
            String walletAddress,
            List<Position> positions,
            BigInteger totalAmount,
            BigInteger totalTokenAllocation
    ) {
    }
}
