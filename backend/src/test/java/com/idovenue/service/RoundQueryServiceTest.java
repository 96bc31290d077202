package com.idovenue.service;

import com.idovenue.controller.dto.IdoRoundResponses;
import com.idovenue.controller.dto.MetaIdoResponses;
import com.idovenue.mapper.IdoResponseMapper;
import com.idovenue.model.RoundPosition;
import com.idovenue.repository.IdoRoundRepository;
import com.idovenue.repository.MetaIdoParticipantRepository;
import com.idovenue.repository.MetaIdoRepository;
import com.idovenue.repository.RoundPositionRepository;
import com.idovenue.repository.RoundTokenFundingRepository;
import com.idovenue.repository.RoundWhitelistEntryRepository;
import com.idovenue.web.IdoErrorCode;
import com.idovenue.web.IdoVenueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.idovenue.service.IdoRoundFixtures.WALLET_A;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoundQueryServiceTest {

    @Mock
    private IdoRoundRepository idoRoundRepository;

    @Mock
    private RoundTokenFundingRepository roundTokenFundingRepository;

    @Mock
    private RoundPositionRepository roundPositionRepository;

    @Mock
    private RoundWhitelistEntryRepository roundWhitelistEntryRepository;

    @Mock
    private MetaIdoRepository metaIdoRepository;

    @Mock
    private MetaIdoParticipantRepository metaIdoParticipantRepository;

    private RoundQueryService roundQueryService;

    @BeforeEach
    void setUp() {
        roundQueryService = new RoundQueryService(
                idoRoundRepository,
                roundTokenFundingRepository,
                roundPositionRepository,
                roundWhitelistEntryRepository,
                metaIdoRepository,
                metaIdoParticipantRepository,
                new IdoResponseMapper()
        );
    }

    @Test
    void getPosition_readsMissingPositionAsZero() {
        when(idoRoundRepository.existsById(1L)).thenReturn(true);
        when(roundPositionRepository.findByRoundIdAndWalletAddress(1L, WALLET_A)).thenReturn(Optional.empty());

        IdoRoundResponses.Position position = roundQueryService.getPosition(1L, WALLET_A.toUpperCase().replace("0X", "0x"));

        assertEquals(WALLET_A, position.walletAddress());
        assertEquals(BigInteger.ZERO, position.amount());
        assertEquals(BigInteger.ZERO, position.tokenAllocation());
    }

    @Test
    void getPosition_unknownRoundFails() {
        when(idoRoundRepository.existsById(9L)).thenReturn(false);

        IdoVenueException ex = assertThrows(IdoVenueException.class, () -> roundQueryService.getPosition(9L, WALLET_A));

        assertEquals(IdoErrorCode.ROUND_NOT_FOUND, ex.getCode());
        verifyNoInteractions(roundPositionRepository);
    }

    @Test
    void getParticipantTier_defaultsToUnregistered() {
        when(metaIdoRepository.existsById(2L)).thenReturn(true);
        when(metaIdoParticipantRepository.findByMetaIdoIdAndWalletAddress(2L, WALLET_A)).thenReturn(Optional.empty());

        MetaIdoResponses.ParticipantTier tier = roundQueryService.getParticipantTier(2L, WALLET_A);

        assertFalse(tier.registered());
        assertEquals(0, tier.rank());
        assertEquals(BigInteger.ZERO, tier.multiplier());
    }

    @Test
    void participantSummary_totalsOnlyRoundsWithPositions() {
        when(idoRoundRepository.findAllByOrderByRoundIdAsc()).thenReturn(List.of(
                IdoRoundFixtures.openRound(1L),
                IdoRoundFixtures.openRound(2L),
                IdoRoundFixtures.openRound(3L)));
        when(roundPositionRepository.findByWalletAddressAndRoundIdIn(WALLET_A, Set.of(1L, 2L, 3L))).thenReturn(List.of(
                position(3L, BigInteger.valueOf(40), BigInteger.valueOf(20)),
                position(1L, BigInteger.valueOf(10), BigInteger.valueOf(5))));

        IdoRoundResponses.ParticipantSummary summary = roundQueryService.participantSummary(WALLET_A, null);

        assertEquals(2, summary.positions().size());
        assertEquals(1L, summary.positions().get(0).roundId());
        assertEquals(3L, summary.positions().get(1).roundId());
        assertEquals(BigInteger.valueOf(50), summary.totalAmount());
        assertEquals(BigInteger.valueOf(25), summary.totalTokenAllocation());
    }

    @Test
    void participantSummary_withNoRoundsReturnsEmptyTotals() {
        when(idoRoundRepository.findAllByOrderByRoundIdAsc()).thenReturn(List.of());

        IdoRoundResponses.ParticipantSummary summary = roundQueryService.participantSummary(WALLET_A, List.of());

        assertTrue(summary.positions().isEmpty());
        assertEquals(BigInteger.ZERO, summary.totalAmount());
        verifyNoInteractions(roundPositionRepository);
    }

    @Test
    void participantSummary_rejectsUnknownRequestedRound() {
        when(idoRoundRepository.existsById(1L)).thenReturn(true);
        when(idoRoundRepository.existsById(7L)).thenReturn(false);

        IdoVenueException ex = assertThrows(IdoVenueException.class,
                () -> roundQueryService.participantSummary(WALLET_A, List.of(1L, 7L)));

        assertEquals(IdoErrorCode.ROUND_NOT_FOUND, ex.getCode());
    }

    private static RoundPosition position(Long roundId, BigInteger amount, BigInteger allocation) {
        RoundPosition position = new RoundPosition();
        position.setRoundId(roundId);
        position.setWalletAddress(WALLET_A);
        position.setAmount(amount);
        position.setTokenAllocation(allocation);
        return position;
    }
}
