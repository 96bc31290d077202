package com.idovenue.service;

import com.idovenue.controller.dto.EligibilityResponses;
import com.idovenue.model.IdoRound;
import com.idovenue.model.MetaIdoParticipant;
import com.idovenue.model.RoundSpec;
import com.idovenue.repository.IdoRoundRepository;
import com.idovenue.repository.MetaIdoParticipantRepository;
import com.idovenue.repository.RoundWhitelistEntryRepository;
import com.idovenue.web.IdoVenueException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Eligibility and allocation rules.
 * Contribution checks run cheap-first: accepted token, whitelist, then the secondary-token cap.
 * The projection side reads MetaIDO tiers and round specs without touching the ledger.
 */
@Service
@RequiredArgsConstructor
public class EligibilityService {

    private static final Logger log = LoggerFactory.getLogger(EligibilityService.class);

    private final IdoRoundRepository idoRoundRepository;
    private final RoundWhitelistEntryRepository roundWhitelistEntryRepository;
    private final MetaIdoParticipantRepository metaIdoParticipantRepository;
    private final FundingLedgerService fundingLedgerService;

    public void validateContribution(IdoRound round, String wallet, String token, BigInteger amount) {
        Long roundId = round.getRoundId();
        if (!round.acceptsToken(token)) {
            throw IdoVenueException.invalidToken("Token " + token + " is not accepted by round " + roundId);
        }

        if (round.getClock().isWhitelistEnabled()
                && !roundWhitelistEntryRepository.existsByRoundIdAndWalletAddress(roundId, wallet)) {
            throw IdoVenueException.notWhitelisted(roundId, wallet);
        }

        if (round.isSecondaryToken(token)) {
            BigInteger projectedGlobalTotal = fundingLedgerService.totalRaised(round).add(amount);
            BigInteger cap = AllocationMath.secondaryCap(round.getIdoSize(), round.getSecondaryCapBps());
            if (projectedGlobalTotal.compareTo(cap) > 0) {
                throw IdoVenueException.secondaryCapExceeded(roundId,
                        "projected total " + projectedGlobalTotal + " exceeds cap " + cap);
            }
        }
    }

    @Transactional(readOnly = true)
    public List<EligibilityResponses.RoundEligibility> project(String wallet, List<Long> roundIds) {
        String participant = WalletAddresses.normalize(wallet);
        List<EligibilityResponses.RoundEligibility> projections = new ArrayList<>();
        for (Long roundId : new LinkedHashSet<>(roundIds)) {
            IdoRound round = idoRoundRepository.findById(roundId)
                    .orElseThrow(() -> IdoVenueException.roundNotFound(roundId));
            projections.add(projectRound(round, participant));
        }
        log.debug("Projected eligibility of {} for {} round(s)", participant, projections.size());
        return projections;
    }

    private EligibilityResponses.RoundEligibility projectRound(IdoRound round, String participant) {
        Long metaIdoId = round.getParentMetaIdoId();
        MetaIdoParticipant tier = metaIdoId == null
                ? null
                : metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(metaIdoId, participant).orElse(null);

        boolean registered = tier != null && tier.isRegistered();
        int rank = tier != null ? tier.getRank() : 0;
        BigInteger multiplier = tier != null ? tier.getMultiplier() : BigInteger.ZERO;

        RoundSpec spec = round.getSpec();
        if (spec == null || !spec.isSpecsInitialized()) {
            return new EligibilityResponses.RoundEligibility(
                    round.getRoundId(), metaIdoId, registered, rank, multiplier, true, null);
        }

        boolean eligible = spec.isNoRank() || (rank >= spec.getMinRank() && rank <= spec.getMaxRank());
        BigInteger maxAllocation = spec.isNoMultiplier()
                ? spec.getMaxAlloc()
                : AllocationMath.scaledMaxAllocation(spec.getMaxAlloc(), multiplier, spec.getMaxAllocMultiplier());

        return new EligibilityResponses.RoundEligibility(
                round.getRoundId(), metaIdoId, registered, rank, multiplier, eligible, maxAllocation);
    }
}
