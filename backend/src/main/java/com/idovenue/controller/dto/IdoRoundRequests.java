package com.idovenue.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.List;

public final class IdoRoundRequests {

    private IdoRoundRequests() {
    }

    /**
     * Window ordering is checked by the round manager so it can answer with INVALID_WINDOW.
     */
    public record CreateRoundRequest(
            @NotBlank(message = "idoToken is required")
            String idoToken,

            @NotBlank(message = "primaryToken is required")
            String primaryToken,

            @NotBlank(message = "secondaryToken is required")
            String secondaryToken,

            @NotNull(message = "idoPrice is required")
            BigInteger idoPrice,

            @NotNull(message = "idoSize is required")
            @PositiveOrZero(message = "idoSize must be non-negative")
            BigInteger idoSize,

            @NotNull(message = "minimumFundingGoal is required")
            @PositiveOrZero(message = "minimumFundingGoal must be non-negative")
            BigInteger minimumFundingGoal,

            Integer secondaryCapBps,

            @NotNull(message = "startTime is required")
            OffsetDateTime startTime,

            @NotNull(message = "endTime is required")
            OffsetDateTime endTime,

            @NotNull(message = "claimableTime is required")
            OffsetDateTime claimableTime,

            Boolean whitelistEnabled
    ) {
    }

    public record DelayRequest(
            @NotNull(message = "newTime is required")
            OffsetDateTime newTime
    ) {
    }

    public record WhitelistStatusRequest(
            @NotNull(message = "enabled is required")
            Boolean enabled
    ) {
    }

    public record ModifyWhitelistRequest(
            @NotNull(message = "addresses is required")
            List<String> addresses,

            @NotNull(message = "add is required")
            Boolean add
    ) {
    }

    public record SecondaryCapRequest(
            @NotNull(message = "basisPoints is required")
            Integer basisPoints
    ) {
    }

    public record RoundSpecRequest(
            @Min(value = 0, message = "minRank must be non-negative")
            int minRank,

            @Min(value = 0, message = "maxRank must be non-negative")
            int maxRank,

            boolean noRank,

            @NotNull(message = "maxAlloc is required")
            @PositiveOrZero(message = "maxAlloc must be non-negative")
            BigInteger maxAlloc,

            @NotNull(message = "maxAllocMultiplier is required")
            @PositiveOrZero(message = "maxAllocMultiplier must be non-negative")
            BigInteger maxAllocMultiplier,

            boolean noMultiplier
    ) {
    }

    public record ParticipateRequest(
            @NotBlank(message = "token is required")
            String token,

            @NotNull(message = "amount is required")
            BigInteger amount
    ) {
    }

    public record DepositInventoryRequest(
            @NotNull(message = "amount is required")
            BigInteger amount
    ) {
    }
}
