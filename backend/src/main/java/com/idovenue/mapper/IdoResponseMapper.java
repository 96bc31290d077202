package com.idovenue.mapper;

import com.idovenue.controller.dto.IdoRoundResponses;
import com.idovenue.controller.dto.MetaIdoResponses;
import com.idovenue.model.IdoRound;
import com.idovenue.model.MetaIdo;
import com.idovenue.model.MetaIdoParticipant;
import com.idovenue.model.RoundClock;
import com.idovenue.model.RoundPosition;
import com.idovenue.model.RoundSpec;
import com.idovenue.model.RoundTokenFunding;
import com.idovenue.service.ParticipationService;
import com.idovenue.service.SettlementService;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;

@Component
public class IdoResponseMapper {

    public IdoRoundResponses.RoundSummary toRoundSummary(IdoRound round) {
        RoundClock clock = round.getClock();
        return new IdoRoundResponses.RoundSummary(
                round.getRoundId(),
                round.getIdoToken(),
                round.getIdoPrice(),
                round.getIdoSize(),
                round.getFundedUsdValue(),
                round.getParentMetaIdoId(),
                clock.getStartTime(),
                clock.getEndTime(),
                clock.getClaimableTime(),
                clock.isFinalized(),
                clock.isWhitelistEnabled()
        );
    }

    public List<IdoRoundResponses.RoundSummary> toRoundSummaries(Collection<IdoRound> rounds) {
        return rounds.stream()
                .map(this::toRoundSummary)
                .toList();
    }

    public IdoRoundResponses.RoundDetail toRoundDetail(IdoRound round, Collection<RoundTokenFunding> funding) {
        RoundClock clock = round.getClock();
        return new IdoRoundResponses.RoundDetail(
                round.getRoundId(),
                round.getIdoToken(),
                round.getIdoTokenDecimals(),
                round.getPrimaryToken(),
                round.getSecondaryToken(),
                round.getIdoPrice(),
                round.getIdoSize(),
                round.getMinimumFundingGoal(),
                round.getFundedUsdValue(),
                round.getSecondaryCapBps(),
                round.getParentMetaIdoId(),
                clock.getStartTime(),
                clock.getEndTime(),
                clock.getInitialEndTime(),
                clock.getClaimableTime(),
                clock.getInitialClaimableTime(),
                clock.isFinalized(),
                clock.isWhitelistEnabled(),
                clock.isSpareWithdrawn(),
                funding.stream()
                        .map(f -> new IdoRoundResponses.TokenFunding(f.getTokenAddress(), f.getTotalFunded()))
                        .toList(),
                toRoundSpec(round.getSpec()),
                round.getCreatedAt(),
                round.getUpdatedAt()
        );
    }

    public IdoRoundResponses.RoundSpec toRoundSpec(RoundSpec spec) {
        if (spec == null) {
            return null;
        }
        return new IdoRoundResponses.RoundSpec(
                spec.isSpecsInitialized(),
                spec.getMinRank(),
                spec.getMaxRank(),
                spec.isNoRank(),
                spec.getMaxAlloc(),
                spec.getMaxAllocMultiplier(),
                spec.isNoMultiplier()
        );
    }

    public IdoRoundResponses.Position toPosition(RoundPosition position) {
        return new IdoRoundResponses.Position(
                position.getRoundId(),
                position.getWalletAddress(),
                position.getAmount(),
                position.getSecondaryAmount(),
                position.getTokenAllocation()
        );
    }

    public IdoRoundResponses.Position emptyPosition(Long roundId, String walletAddress) {
        return new IdoRoundResponses.Position(
                roundId,
                walletAddress,
                BigInteger.ZERO,
                BigInteger.ZERO,
                BigInteger.ZERO
        );
    }

    public IdoRoundResponses.ParticipationReceipt toParticipationReceipt(
            ParticipationService.ParticipationResult result) {
        RoundPosition position = result.contribution().position();
        return new IdoRoundResponses.ParticipationReceipt(
                result.round().getRoundId(),
                position.getWalletAddress(),
                result.token(),
                result.amount(),
                result.contribution().allocation(),
                toPosition(position)
        );
    }

    public IdoRoundResponses.ClaimReceipt toClaimReceipt(SettlementService.ClaimResult result) {
        return new IdoRoundResponses.ClaimReceipt(
                result.roundId(),
                result.walletAddress(),
                result.primaryAmount(),
                result.secondaryAmount(),
                result.tokenAllocation()
        );
    }

    public MetaIdoResponses.MetaIdoDetail toMetaIdoDetail(MetaIdo metaIdo, long registeredParticipants) {
        return new MetaIdoResponses.MetaIdoDetail(
                metaIdo.getMetaIdoId(),
                List.copyOf(metaIdo.getRoundIds()),
                registeredParticipants,
                metaIdo.getCreatedAt(),
                metaIdo.getUpdatedAt()
        );
    }

    public MetaIdoResponses.ParticipantTier toParticipantTier(MetaIdoParticipant participant) {
        return new MetaIdoResponses.ParticipantTier(
                participant.getMetaIdoId(),
                participant.getWalletAddress(),
                participant.isRegistered(),
                participant.getRank(),
                participant.getMultiplier()
        );
    }

    public List<MetaIdoResponses.ParticipantTier> toParticipantTiers(Collection<MetaIdoParticipant> participants) {
        return participants.stream()
                .map(this::toParticipantTier)
                .toList();
    }
}
