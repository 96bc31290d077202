package com.idovenue.service;

import com.idovenue.event.IdoEvents;
import com.idovenue.gateway.TokenTransferGateway;
import com.idovenue.model.IdoRound;
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
 * Contributions of primary or secondary payment tokens into an open round.
 * The round row is locked for the whole call so concurrent contributions to the same round
 * see each other's totals when checking the secondary-token cap.
 */
@Service
@RequiredArgsConstructor
public class ParticipationService {

    private static final Logger log = LoggerFactory.getLogger(ParticipationService.class);

    private final IdoRoundRepository idoRoundRepository;
    private final EligibilityService eligibilityService;
    private final FundingLedgerService fundingLedgerService;
    private final TokenTransferGateway tokenTransferGateway;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    @Transactional
    public ParticipationResult participate(String participant, Long roundId, String token, BigInteger amount) {
        String wallet = WalletAddresses.normalize(participant);
        IdoRound round = idoRoundRepository.findByRoundIdForUpdate(roundId)
                .orElseThrow(() -> IdoVenueException.roundNotFound(roundId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!round.getClock().hasStarted(now)) {
            throw IdoVenueException.notStarted(roundId);
        }
        if (round.getClock().isFinalized()) {
            throw IdoVenueException.alreadyFinalized(roundId);
        }
        if (round.getClock().isSpareWithdrawn()) {
            throw IdoVenueException.contributionsClosed(roundId, "spare inventory was withdrawn");
        }
        if (amount == null || amount.signum() <= 0) {
            throw IdoVenueException.invalidAmount("Contribution amount must be positive");
        }
        String tokenAddress = WalletAddresses.normalize(token);

        eligibilityService.validateContribution(round, wallet, tokenAddress, amount);

        FundingLedgerService.Contribution contribution =
                fundingLedgerService.recordContribution(round, wallet, tokenAddress, amount, now);
        idoRoundRepository.save(round);
        tokenTransferGateway.pull(tokenAddress, wallet, amount);

        log.info("Round {} participation: {} contributed {} {} for {} sale token units",
                roundId, wallet, amount, tokenAddress, contribution.allocation());
        applicationEventPublisher.publishEvent(new IdoEvents.ParticipationRecorded(
                roundId, wallet, tokenAddress, amount, contribution.allocation()));
        return new ParticipationResult(round, tokenAddress, amount, contribution);
    }

    public record ParticipationResult(
            IdoRound round,
            String token,
            BigInteger amount,
            FundingLedgerService.Contribution contribution
    ) {
    }
}
