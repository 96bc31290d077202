package com.idovenue.service;

import com.idovenue.event.IdoEvents;
import com.idovenue.gateway.OwnershipGate;
import com.idovenue.model.IdSequence;
import com.idovenue.model.IdoRound;
import com.idovenue.model.MetaIdo;
import com.idovenue.model.MetaIdoParticipant;
import com.idovenue.repository.IdoRoundRepository;
import com.idovenue.repository.MetaIdoParticipantRepository;
import com.idovenue.repository.MetaIdoRepository;
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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * MetaIDO groups and their participant tier table.
 */
@Service
@RequiredArgsConstructor
public class MetaIdoService {

    private static final Logger log = LoggerFactory.getLogger(MetaIdoService.class);

    private final MetaIdoRepository metaIdoRepository;
    private final MetaIdoParticipantRepository metaIdoParticipantRepository;
    private final IdoRoundRepository idoRoundRepository;
    private final IdSequenceService idSequenceService;
    private final OwnershipGate ownershipGate;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    @Transactional
    public MetaIdo createMetaIdo(String caller) {
        ownershipGate.requireOwner(caller);
        long metaIdoId = idSequenceService.next(IdSequence.META_IDO);
        OffsetDateTime now = OffsetDateTime.now(clock);

        MetaIdo metaIdo = new MetaIdo();
        metaIdo.setMetaIdoId(metaIdoId);
        metaIdo.setCreatedAt(now);
        metaIdo.setUpdatedAt(now);
        MetaIdo saved = metaIdoRepository.save(metaIdo);

        applicationEventPublisher.publishEvent(new IdoEvents.MetaIdoCreated(metaIdoId));
        return saved;
    }

    /**
     * Adds or removes a round. A round belongs to at most one MetaIDO; removal swaps the last
     * member into the freed slot.
     */
    @Transactional
    public MetaIdo manageRoundInMetaIdo(String caller, Long metaIdoId, Long roundId, boolean add) {
        ownershipGate.requireOwner(caller);
        MetaIdo metaIdo = metaIdoRepository.findByMetaIdoIdForUpdate(metaIdoId)
                .orElseThrow(() -> IdoVenueException.metaIdoNotFound(metaIdoId));
        IdoRound round = idoRoundRepository.findByRoundIdForUpdate(roundId)
                .orElseThrow(() -> IdoVenueException.roundNotFound(roundId));
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (add) {
            if (round.getParentMetaIdoId() != null) {
                throw IdoVenueException.roundAlreadyInMetaIdo(roundId, round.getParentMetaIdoId());
            }
            metaIdo.getRoundIds().add(roundId);
            round.setParentMetaIdoId(metaIdoId);
        } else {
            if (!metaIdo.swapRemove(roundId)) {
                throw IdoVenueException.roundNotInMetaIdo(metaIdoId, roundId);
            }
            round.setParentMetaIdoId(null);
        }
        round.setUpdatedAt(now);
        idoRoundRepository.save(round);
        metaIdo.setUpdatedAt(now);
        MetaIdo saved = metaIdoRepository.save(metaIdo);

        applicationEventPublisher.publishEvent(new IdoEvents.MetaIdoMembershipChanged(metaIdoId, roundId, add));
        return saved;
    }

    @Transactional
    public MetaIdoParticipant registerForMetaIdo(String participant, Long metaIdoId) {
        String wallet = WalletAddresses.normalize(participant);
        if (!metaIdoRepository.existsById(metaIdoId)) {
            throw IdoVenueException.metaIdoNotFound(metaIdoId);
        }
        MetaIdoParticipant entry = findOrCreate(metaIdoId, wallet);
        if (entry.isRegistered()) {
            log.debug("Wallet {} already registered for MetaIDO {}", wallet, metaIdoId);
            return entry;
        }
        entry.setRegistered(true);
        entry.setUpdatedAt(OffsetDateTime.now(clock));
        MetaIdoParticipant saved = metaIdoParticipantRepository.save(entry);
        log.info("Wallet {} registered for MetaIDO {}", wallet, metaIdoId);
        return saved;
    }

    /**
     * Assigns the same rank and multiplier to every wallet in the batch. Tiers may be set before
     * the wallet registers.
     */
    @Transactional
    public List<MetaIdoParticipant> setParticipantTier(String caller,
                                                       Long metaIdoId,
                                                       List<String> wallets,
                                                       int rank,
                                                       BigInteger multiplier) {
        ownershipGate.requireOwner(caller);
        if (!metaIdoRepository.existsById(metaIdoId)) {
            throw IdoVenueException.metaIdoNotFound(metaIdoId);
        }
        if (wallets == null || wallets.isEmpty()) {
            throw IdoVenueException.emptyAddressList();
        }
        if (rank < 0 || multiplier == null || multiplier.signum() < 0) {
            throw IdoVenueException.invalidAmount("rank and multiplier must be non-negative");
        }

        Set<String> normalized = new LinkedHashSet<>();
        for (String wallet : wallets) {
            normalized.add(WalletAddresses.normalize(wallet));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<MetaIdoParticipant> updated = new ArrayList<>();
        for (String wallet : normalized) {
            MetaIdoParticipant entry = findOrCreate(metaIdoId, wallet);
            entry.setRank(rank);
            entry.setMultiplier(multiplier);
            entry.setUpdatedAt(now);
            updated.add(metaIdoParticipantRepository.save(entry));
        }

        log.info("MetaIDO {} tier rank={} multiplier={} set for {} wallet(s)",
                metaIdoId, rank, multiplier, updated.size());
        return updated;
    }

    private MetaIdoParticipant findOrCreate(Long metaIdoId, String wallet) {
        return metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(metaIdoId, wallet)
                .orElseGet(() -> {
                    MetaIdoParticipant created = new MetaIdoParticipant();
                    created.setMetaIdoId(metaIdoId);
                    created.setWalletAddress(wallet);
                    created.setUpdatedAt(OffsetDateTime.now(clock));
                    return created;
                });
    }
}
