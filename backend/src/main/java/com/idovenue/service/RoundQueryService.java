package com.idovenue.service;

import com.idovenue.controller.dto.IdoRoundResponses;
import com.idovenue.controller.dto.MetaIdoResponses;
import com.idovenue.mapper.IdoResponseMapper;
import com.idovenue.model.IdoRound;
import com.idovenue.model.MetaIdo;
import com.idovenue.model.RoundPosition;
import com.idovenue.repository.IdoRoundRepository;
import com.idovenue.repository.MetaIdoParticipantRepository;
import com.idovenue.repository.MetaIdoRepository;
import com.idovenue.repository.RoundPositionRepository;
import com.idovenue.repository.RoundTokenFundingRepository;
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
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RoundQueryService {

    private static final Logger log = LoggerFactory.getLogger(RoundQueryService.class);

    private final IdoRoundRepository idoRoundRepository;
    private final RoundTokenFundingRepository roundTokenFundingRepository;
    private final RoundPositionRepository roundPositionRepository;
    private final RoundWhitelistEntryRepository roundWhitelistEntryRepository;
    private final MetaIdoRepository metaIdoRepository;
    private final MetaIdoParticipantRepository metaIdoParticipantRepository;
    private final IdoResponseMapper idoResponseMapper;

    public IdoRoundResponses.RoundDetail getRound(Long roundId) {
        IdoRound round = idoRoundRepository.findById(roundId)
                .orElseThrow(() -> IdoVenueException.roundNotFound(roundId));
        return idoResponseMapper.toRoundDetail(round, roundTokenFundingRepository.findByRoundIdOrderByTokenAddressAsc(roundId));
    }

    public List<IdoRoundResponses.RoundSummary> listRounds() {
        return idoResponseMapper.toRoundSummaries(idoRoundRepository.findAllByOrderByRoundIdAsc());
    }

    /**
     * Position of a wallet in a round; a wallet that never contributed, or already claimed,
     * reads as an all-zero position.
     */
    public IdoRoundResponses.Position getPosition(Long roundId, String wallet) {
        requireRound(roundId);
        String walletAddress = WalletAddresses.normalize(wallet);
        return roundPositionRepository.findByRoundIdAndWalletAddress(roundId, walletAddress)
                .map(idoResponseMapper::toPosition)
                .orElseGet(() -> idoResponseMapper.emptyPosition(roundId, walletAddress));
    }

    public IdoRoundResponses.WhitelistStatus isWhitelisted(Long roundId, String wallet) {
        requireRound(roundId);
        String walletAddress = WalletAddresses.normalize(wallet);
        boolean whitelisted = roundWhitelistEntryRepository.existsByRoundIdAndWalletAddress(roundId, walletAddress);
        return new IdoRoundResponses.WhitelistStatus(roundId, walletAddress, whitelisted);
    }

    public MetaIdoResponses.MetaIdoDetail getMetaIdo(Long metaIdoId) {
        MetaIdo metaIdo = metaIdoRepository.findById(metaIdoId)
                .orElseThrow(() -> IdoVenueException.metaIdoNotFound(metaIdoId));
        return idoResponseMapper.toMetaIdoDetail(
                metaIdo, metaIdoParticipantRepository.countByMetaIdoIdAndRegisteredTrue(metaIdoId));
    }

    public MetaIdoResponses.ParticipantTier getParticipantTier(Long metaIdoId, String wallet) {
        if (!metaIdoRepository.existsById(metaIdoId)) {
            throw IdoVenueException.metaIdoNotFound(metaIdoId);
        }
        String walletAddress = WalletAddresses.normalize(wallet);
        return metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(metaIdoId, walletAddress)
                .map(idoResponseMapper::toParticipantTier)
                .orElseGet(() -> new MetaIdoResponses.ParticipantTier(
                        metaIdoId, walletAddress, false, 0, BigInteger.ZERO));
    }

    /**
     * Positions across the requested rounds (every round when none are given) with totals.
     * Rounds the wallet holds no position in are left out.
     */
    public IdoRoundResponses.ParticipantSummary participantSummary(String wallet, List<Long> roundIds) {
        String walletAddress = WalletAddresses.normalize(wallet);
        Set<Long> requested = new LinkedHashSet<>();
        if (roundIds == null || roundIds.isEmpty()) {
            idoRoundRepository.findAllByOrderByRoundIdAsc().forEach(round -> requested.add(round.getRoundId()));
        } else {
            for (Long roundId : roundIds) {
                requireRound(roundId);
                requested.add(roundId);
            }
        }
        if (requested.isEmpty()) {
            return new IdoRoundResponses.ParticipantSummary(walletAddress, List.of(), BigInteger.ZERO, BigInteger.ZERO);
        }

        Map<Long, RoundPosition> byRound = roundPositionRepository
                .findByWalletAddressAndRoundIdIn(walletAddress, requested).stream()
                .collect(Collectors.toMap(RoundPosition::getRoundId, Function.identity()));

        List<IdoRoundResponses.Position> positions = new ArrayList<>();
        BigInteger totalAmount = BigInteger.ZERO;
        BigInteger totalTokenAllocation = BigInteger.ZERO;
        for (Long roundId : requested) {
            RoundPosition position = byRound.get(roundId);
            if (position == null) {
                continue;
            }
            positions.add(idoResponseMapper.toPosition(position));
            totalAmount = totalAmount.add(position.getAmount());
            totalTokenAllocation = totalTokenAllocation.add(position.getTokenAllocation());
        }

        log.debug("Summary for {}: {} position(s) across {} round(s)", walletAddress, positions.size(), requested.size());
        return new IdoRoundResponses.ParticipantSummary(walletAddress, positions, totalAmount, totalTokenAllocation);
    }

    private void requireRound(Long roundId) {
        if (!idoRoundRepository.existsById(roundId)) {
            throw IdoVenueException.roundNotFound(roundId);
        }
    }
}
