package com.idovenue.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.util.List;

public final class MetaIdoRequests {

    private MetaIdoRequests() {
    }

    public record ManageRoundRequest(
            @NotNull(message = "roundId is required")
            Long roundId,

            @NotNull(message = "add is required")
            Boolean add
    ) {
    }

    public record ParticipantTierRequest(
            @NotNull(message = "wallets is required")
            List<String> wallets,

            @Min(value = 0, message = "rank must be non-negative")
            int rank,

            @NotNull(message = "multiplier is required")
            @PositiveOrZero(message = "multiplier must be non-negative")
            BigInteger multiplier
    ) {
    }
}
