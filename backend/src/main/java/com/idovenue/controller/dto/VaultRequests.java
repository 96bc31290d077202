package com.idovenue.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class VaultRequests {

    private VaultRequests() {
    }

    public record CreditRequest(
            @NotBlank(message = "token is required")
            String token,

            @NotBlank(message = "holder is required")
            String holder,

            @NotNull(message = "amount is required")
            BigInteger amount
    ) {
    }

    public record BalanceResponse(
            String token,
            String holder,
            BigInteger balance
    ) {
    }
}
