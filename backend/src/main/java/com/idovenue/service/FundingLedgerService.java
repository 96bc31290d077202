package com.idovenue.service;

import com.idovenue.model.IdoRound;
import com.idovenue.model.RoundPosition;
import com.idovenue.model.RoundTokenFunding;
import com.idovenue.repository.RoundPositionRepository;
import com.idovenue.repository.RoundTokenFundingRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Accounting source of truth for rounds: per-token running totals and per-participant
 * positions. Callers hold the round lock and own the transaction.
 */
@Service
@RequiredArgsConstructor
public class FundingLedgerService {

    private static final Logger log = LoggerFactory.getLogger(FundingLedgerService.class);

    private final RoundPositionRepository roundPositionRepository;
    private final RoundTokenFundingRepository roundTokenFundingRepository;

    public BigInteger totalFunded(Long roundId, String token) {
        return roundTokenFundingRepository.findByRoundIdAndTokenAddress(roundId, token)
                .map(RoundTokenFunding::getTotalFunded)
                .orElse(BigInteger.ZERO);
    }

    /**
     * Cross-token total raised by the round; both payment tokens count one unit as one USD.
     */
    public BigInteger totalRaised(IdoRound round) {
        return totalFunded(round.getRoundId(), round.getPrimaryToken())
                .add(totalFunded(round.getRoundId(), round.getSecondaryToken()));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Contribution recordContribution(IdoRound round,
                                           String wallet,
                                           String token,
                                           BigInteger amount,
                                           OffsetDateTime now) {
        Long roundId = round.getRoundId();
        BigInteger allocation = AllocationMath.allocationFor(amount, round.getIdoTokenDecimals(), round.getIdoPrice());

        RoundPosition position = roundPositionRepository.findByRoundIdAndWalletAddress(roundId, wallet)
                .orElseGet(() -> {
                    RoundPosition created = new RoundPosition();
                    created.setRoundId(roundId);
                    created.setWalletAddress(wallet);
                    created.setCreatedAt(now);
                    return created;
                });
        position.setAmount(position.getAmount().add(amount));
        if (round.isSecondaryToken(token)) {
            position.setSecondaryAmount(position.getSecondaryAmount().add(amount));
        }
        position.setTokenAllocation(position.getTokenAllocation().add(allocation));
        position.setUpdatedAt(now);
        RoundPosition savedPosition = roundPositionRepository.save(position);

        RoundTokenFunding funding = roundTokenFundingRepository.findByRoundIdAndTokenAddress(roundId, token)
                .orElseGet(() -> {
                    RoundTokenFunding created = new RoundTokenFunding();
                    created.setRoundId(roundId);
                    created.setTokenAddress(token);
                    return created;
                });
        funding.setTotalFunded(funding.getTotalFunded().add(amount));
        roundTokenFundingRepository.save(funding);

        round.setFundedUsdValue(round.getFundedUsdValue().add(amount));
        round.setUpdatedAt(now);

        log.debug("Round {} ledger: {} +{} {} (allocation +{}), token total {}",
                roundId, wallet, amount, token, allocation, funding.getTotalFunded());
        return new Contribution(savedPosition, allocation);
    }

    public Optional<RoundPosition> findPosition(Long roundId, String wallet) {
        return roundPositionRepository.findByRoundIdAndWalletAddress(roundId, wallet);
    }

    /**
     * Deletes the position so it can never be settled twice.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void deletePosition(RoundPosition position) {
        roundPositionRepository.delete(position);
        roundPositionRepository.flush();
    }

    public record Contribution(RoundPosition position, BigInteger allocation) {
    }
}
