package com.idovenue.service;

import com.idovenue.config.IdoVenueProperties;
import com.idovenue.event.IdoEvents;
import com.idovenue.gateway.OwnershipGate;
import com.idovenue.gateway.TokenMetadataGateway;
import com.idovenue.gateway.TokenTransferGateway;
import com.idovenue.model.IdoRound;
import com.idovenue.model.RoundPosition;
import com.idovenue.repository.IdoRoundRepository;
import com.idovenue.web.IdoVenueException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Post-sale settlement: participant claims and the operator's withdrawal of unsold inventory.
 */
@Service
@RequiredArgsConstructor
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final IdoRoundRepository idoRoundRepository;
    private final FundingLedgerService fundingLedgerService;
    private final TokenTransferGateway tokenTransferGateway;
    private final TokenMetadataGateway tokenMetadataGateway;
    private final OwnershipGate ownershipGate;
    private final IdoVenueProperties idoVenueProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Settles a participant's position. Contributions go to the treasury and the allocation
     * goes to the participant. The position is removed before any transfer, so a second claim
     * fails with NO_POSITION.
     */
    @Transactional
    public ClaimResult claim(Long roundId, String participant) {
        String wallet = WalletAddresses.normalize(participant);
        IdoRound round = lockRound(roundId);
        if (!round.getClock().isClaimable(OffsetDateTime.now(clock))) {
            throw IdoVenueException.notClaimable(roundId);
        }

        RoundPosition position = fundingLedgerService.findPosition(roundId, wallet)
                .filter(p -> p.getAmount().signum() > 0)
                .orElseThrow(() -> IdoVenueException.noPosition(roundId, wallet));

        BigInteger secondaryAmount = position.getSecondaryAmount();
        BigInteger primaryAmount = position.primaryAmount();
        BigInteger tokenAllocation = position.getTokenAllocation();
        fundingLedgerService.deletePosition(position);

        String treasury = idoVenueProperties.getTreasuryAddress();
        if (secondaryAmount.signum() > 0) {
            tokenTransferGateway.push(round.getSecondaryToken(), treasury, secondaryAmount);
        }
        if (primaryAmount.signum() > 0) {
            tokenTransferGateway.push(round.getPrimaryToken(), treasury, primaryAmount);
        }
        if (tokenAllocation.signum() > 0) {
            tokenTransferGateway.push(round.getIdoToken(), wallet, tokenAllocation);
        }

        log.info("Round {} claim by {}: {} primary, {} secondary to treasury, {} sale tokens released",
                roundId, wallet, primaryAmount, secondaryAmount, tokenAllocation);
        applicationEventPublisher.publishEvent(new IdoEvents.Claimed(
                roundId, wallet, position.getAmount(), secondaryAmount, tokenAllocation));
        return new ClaimResult(roundId, wallet, primaryAmount, secondaryAmount, tokenAllocation);
    }

    /**
     * Returns unsold sale-token inventory to the caller when the round ended below its full
     * sale value. Only possible before finalization, and closes the round to contributions
     * so no later allocation can outgrow the inventory left in custody.
     */
    @Transactional
    public BigInteger withdrawSpareTokens(String caller, Long roundId) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        if (round.getClock().isFinalized()) {
            throw IdoVenueException.alreadyFinalized(roundId);
        }
        if (!round.getClock().hasEnded(OffsetDateTime.now(clock))) {
            throw IdoVenueException.idoNotEnded(roundId);
        }

        int decimals = round.getIdoTokenDecimals();
        BigInteger totalGoalValue = AllocationMath.totalGoalValue(round.getIdoSize(), round.getIdoPrice(), decimals);
        BigInteger fundedUsdValue = round.getFundedUsdValue();
        if (totalGoalValue.compareTo(fundedUsdValue) <= 0) {
            throw IdoVenueException.fundingGoalReached(roundId,
                    "raised " + fundedUsdValue + " covers sale value " + totalGoalValue);
        }

        BigInteger totalSold = AllocationMath.soldEquivalent(fundedUsdValue, round.getIdoPrice(), decimals);
        BigInteger held = tokenMetadataGateway.balanceOf(idoVenueProperties.getCustodyAddress(), round.getIdoToken());
        BigInteger spare = held.subtract(totalSold);
        if (spare.signum() <= 0) {
            throw IdoVenueException.noSpareTokens(roundId);
        }

        String recipient = WalletAddresses.normalize(caller);
        round.getClock().setSpareWithdrawn(true);
        round.setUpdatedAt(OffsetDateTime.now(clock));
        idoRoundRepository.save(round);
        tokenTransferGateway.push(round.getIdoToken(), recipient, spare);

        log.info("Round {} spare inventory of {} withdrawn to {} ({} sold equivalent)",
                roundId, spare, recipient, totalSold);
        applicationEventPublisher.publishEvent(new IdoEvents.SpareTokensWithdrawn(roundId, recipient, spare));
        return spare;
    }

    private IdoRound lockRound(Long roundId) {
        return idoRoundRepository.findByRoundIdForUpdate(roundId)
                .orElseThrow(() -> IdoVenueException.roundNotFound(roundId));
    }

    public record ClaimResult(
            Long roundId,
            String walletAddress,
            BigInteger primaryAmount,
            BigInteger secondaryAmount,
            BigInteger tokenAllocation
    ) {
    }
}
