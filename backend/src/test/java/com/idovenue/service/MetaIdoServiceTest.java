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
import com.idovenue.web.IdoErrorCode;
import com.idovenue.web.IdoVenueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.idovenue.service.IdoRoundFixtures.CLOCK;
import static com.idovenue.service.IdoRoundFixtures.NOW;
import static com.idovenue.service.IdoRoundFixtures.OWNER;
import static com.idovenue.service.IdoRoundFixtures.WALLET_A;
import static com.idovenue.service.IdoRoundFixtures.WALLET_B;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetaIdoServiceTest {

    @Mock
    private MetaIdoRepository metaIdoRepository;

    @Mock
    private MetaIdoParticipantRepository metaIdoParticipantRepository;

    @Mock
    private IdoRoundRepository idoRoundRepository;

    @Mock
    private IdSequenceService idSequenceService;

    @Mock
    private OwnershipGate ownershipGate;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private MetaIdoService metaIdoService;

    @BeforeEach
    void setUp() {
        metaIdoService = new MetaIdoService(
                metaIdoRepository,
                metaIdoParticipantRepository,
                idoRoundRepository,
                idSequenceService,
                ownershipGate,
                applicationEventPublisher,
                CLOCK
        );
    }

    @Test
    void createMetaIdo_allocatesNextId() {
        when(idSequenceService.next(IdSequence.META_IDO)).thenReturn(3L);
        when(metaIdoRepository.save(any(MetaIdo.class))).thenAnswer(invocation -> invocation.getArgument(0));

        MetaIdo metaIdo = metaIdoService.createMetaIdo(OWNER);

        assertEquals(3L, metaIdo.getMetaIdoId());
        assertTrue(metaIdo.getRoundIds().isEmpty());
        assertEquals(NOW, metaIdo.getCreatedAt());
        verify(applicationEventPublisher).publishEvent(new IdoEvents.MetaIdoCreated(3L));
    }

    @Test
    void manageRoundInMetaIdo_addSetsParentAndAppends() {
        MetaIdo metaIdo = metaIdo(1L);
        IdoRound round = IdoRoundFixtures.upcomingRound(10L);
        when(metaIdoRepository.findByMetaIdoIdForUpdate(1L)).thenReturn(Optional.of(metaIdo));
        when(idoRoundRepository.findByRoundIdForUpdate(10L)).thenReturn(Optional.of(round));
        when(metaIdoRepository.save(metaIdo)).thenReturn(metaIdo);

        metaIdoService.manageRoundInMetaIdo(OWNER, 1L, 10L, true);

        assertEquals(List.of(10L), metaIdo.getRoundIds());
        assertEquals(1L, round.getParentMetaIdoId());
        verify(applicationEventPublisher).publishEvent(new IdoEvents.MetaIdoMembershipChanged(1L, 10L, true));
    }

    @Test
    void manageRoundInMetaIdo_addRejectsRoundWithExistingParent() {
        MetaIdo metaIdo = metaIdo(1L);
        IdoRound round = IdoRoundFixtures.upcomingRound(10L);
        round.setParentMetaIdoId(2L);
        when(metaIdoRepository.findByMetaIdoIdForUpdate(1L)).thenReturn(Optional.of(metaIdo));
        when(idoRoundRepository.findByRoundIdForUpdate(10L)).thenReturn(Optional.of(round));

        IdoVenueException ex = assertThrows(IdoVenueException.class,
                () -> metaIdoService.manageRoundInMetaIdo(OWNER, 1L, 10L, true));

        assertEquals(IdoErrorCode.ROUND_ALREADY_IN_META_IDO, ex.getCode());
        assertTrue(metaIdo.getRoundIds().isEmpty());
    }

    @Test
    void manageRoundInMetaIdo_removeSwapsLastMemberIntoSlot() {
        MetaIdo metaIdo = metaIdo(1L);
        metaIdo.getRoundIds().addAll(List.of(10L, 11L, 12L));
        IdoRound round = IdoRoundFixtures.upcomingRound(10L);
        round.setParentMetaIdoId(1L);
        when(metaIdoRepository.findByMetaIdoIdForUpdate(1L)).thenReturn(Optional.of(metaIdo));
        when(idoRoundRepository.findByRoundIdForUpdate(10L)).thenReturn(Optional.of(round));
        when(metaIdoRepository.save(metaIdo)).thenReturn(metaIdo);

        metaIdoService.manageRoundInMetaIdo(OWNER, 1L, 10L, false);

        assertEquals(List.of(12L, 11L), metaIdo.getRoundIds());
        assertNull(round.getParentMetaIdoId());
    }

    @Test
    void manageRoundInMetaIdo_removeOfAbsentRoundFails() {
        MetaIdo metaIdo = metaIdo(1L);
        when(metaIdoRepository.findByMetaIdoIdForUpdate(1L)).thenReturn(Optional.of(metaIdo));
        when(idoRoundRepository.findByRoundIdForUpdate(10L)).thenReturn(Optional.of(IdoRoundFixtures.upcomingRound(10L)));

        IdoVenueException ex = assertThrows(IdoVenueException.class,
                () -> metaIdoService.manageRoundInMetaIdo(OWNER, 1L, 10L, false));

        assertEquals(IdoErrorCode.ROUND_NOT_IN_META_IDO, ex.getCode());
        verify(metaIdoRepository, never()).save(any(MetaIdo.class));
    }

    @Test
    void manageRoundInMetaIdo_unknownMetaIdoFails() {
        when(metaIdoRepository.findByMetaIdoIdForUpdate(5L)).thenReturn(Optional.empty());

        IdoVenueException ex = assertThrows(IdoVenueException.class,
                () -> metaIdoService.manageRoundInMetaIdo(OWNER, 5L, 10L, true));

        assertEquals(IdoErrorCode.META_IDO_NOT_FOUND, ex.getCode());
    }

    @Test
    void registerForMetaIdo_marksParticipantRegistered() {
        when(metaIdoRepository.existsById(1L)).thenReturn(true);
        when(metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(1L, WALLET_A)).thenReturn(Optional.empty());
        when(metaIdoParticipantRepository.save(any(MetaIdoParticipant.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        MetaIdoParticipant participant = metaIdoService.registerForMetaIdo(WALLET_A, 1L);

        assertTrue(participant.isRegistered());
        assertEquals(WALLET_A, participant.getWalletAddress());
        assertEquals(0, participant.getRank());
    }

    @Test
    void setParticipantTier_appliesRankAndMultiplierToEachWallet() {
        MetaIdoParticipant existing = new MetaIdoParticipant();
        existing.setMetaIdoId(1L);
        existing.setWalletAddress(WALLET_A);
        existing.setRegistered(true);
        when(metaIdoRepository.existsById(1L)).thenReturn(true);
        when(metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(1L, WALLET_A)).thenReturn(Optional.of(existing));
        when(metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(1L, WALLET_B)).thenReturn(Optional.empty());
        when(metaIdoParticipantRepository.save(any(MetaIdoParticipant.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        List<MetaIdoParticipant> updated = metaIdoService.setParticipantTier(
                OWNER, 1L, List.of(WALLET_A, WALLET_B), 2, BigInteger.valueOf(150_000_000));

        assertEquals(2, updated.size());
        assertTrue(updated.get(0).isRegistered());
        assertEquals(2, updated.get(1).getRank());
        assertEquals(BigInteger.valueOf(150_000_000), updated.get(1).getMultiplier());
    }

    private static MetaIdo metaIdo(Long id) {
        MetaIdo metaIdo = new MetaIdo();
        metaIdo.setMetaIdoId(id);
        metaIdo.setRoundIds(new ArrayList<>());
        metaIdo.setCreatedAt(NOW);
        metaIdo.setUpdatedAt(NOW);
        return metaIdo;
    }
}
