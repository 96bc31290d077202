package com.idovenue.controller.dto;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.List;

public final class MetaIdoResponses {

    private MetaIdoResponses() {
    }

    public record MetaIdoDetail(
            Long metaIdoId,
            List<Long> roundIds,
            long registeredParticipants,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record ParticipantTier(
            Long metaIdoId,
            String walletAddress,
            boolean registered,
            int rank,
            BigInteger multiplier
    ) {
    }
}
