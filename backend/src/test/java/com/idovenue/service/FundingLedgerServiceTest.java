package com.idovenue.service;

import com.idovenue.model.IdoRound;
import com.idovenue.model.RoundPosition;
import com.idovenue.model.RoundTokenFunding;
import com.idovenue.repository.RoundPositionRepository;
import com.idovenue.repository.RoundTokenFundingRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Optional;

import static com.idovenue.service.IdoRoundFixtures.NOW;
import static com.idovenue.service.IdoRoundFixtures.PRIMARY_TOKEN;
import static com.idovenue.service.IdoRoundFixtures.SECONDARY_TOKEN;
import static com.idovenue.service.IdoRoundFixtures.WALLET_A;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FundingLedgerServiceTest {

    @Mock
    private RoundPositionRepository roundPositionRepository;

    @Mock
    private RoundTokenFundingRepository roundTokenFundingRepository;

    @InjectMocks
    private FundingLedgerService fundingLedgerService;

    @Test
    void totalRaised_sumsBothPaymentTokensAndDefaultsMissingToZero() {
        IdoRound round = IdoRoundFixtures.openRound(1L);
        when(roundTokenFundingRepository.findByRoundIdAndTokenAddress(1L, PRIMARY_TOKEN))
                .thenReturn(Optional.of(funding(PRIMARY_TOKEN, 120)));
        when(roundTokenFundingRepository.findByRoundIdAndTokenAddress(1L, SECONDARY_TOKEN))
                .thenReturn(Optional.empty());

        assertEquals(BigInteger.valueOf(120), fundingLedgerService.totalRaised(round));
    }

    @Test
    void recordContribution_createsPositionAndTokenTotal() {
        IdoRound round = IdoRoundFixtures.openRound(1L);
        BigInteger amount = BigInteger.valueOf(1_000_000);
        when(roundPositionRepository.findByRoundIdAndWalletAddress(1L, WALLET_A)).thenReturn(Optional.empty());
        when(roundPositionRepository.save(any(RoundPosition.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(roundTokenFundingRepository.findByRoundIdAndTokenAddress(1L, PRIMARY_TOKEN)).thenReturn(Optional.empty());

        FundingLedgerService.Contribution contribution =
                fundingLedgerService.recordContribution(round, WALLET_A, PRIMARY_TOKEN, amount, NOW);

        BigInteger expectedAllocation = BigInteger.valueOf(5).multiply(BigInteger.TEN.pow(23));
        assertEquals(expectedAllocation, contribution.allocation());
        assertEquals(amount, contribution.position().getAmount());
        assertEquals(BigInteger.ZERO, contribution.position().getSecondaryAmount());
        assertEquals(expectedAllocation, contribution.position().getTokenAllocation());
        assertEquals(amount, round.getFundedUsdValue());

        ArgumentCaptor<RoundTokenFunding> fundingCaptor = ArgumentCaptor.forClass(RoundTokenFunding.class);
        verify(roundTokenFundingRepository).save(fundingCaptor.capture());
        assertEquals(amount, fundingCaptor.getValue().getTotalFunded());
    }

    @Test
    void recordContribution_accumulatesSecondaryAmountOnExistingPosition() {
        IdoRound round = IdoRoundFixtures.openRound(1L);
        round.setFundedUsdValue(BigInteger.valueOf(100));
        RoundPosition existing = new RoundPosition();
        existing.setRoundId(1L);
        existing.setWalletAddress(WALLET_A);
        existing.setAmount(BigInteger.valueOf(100));
        existing.setTokenAllocation(BigInteger.valueOf(50).multiply(BigInteger.TEN.pow(18)));
        when(roundPositionRepository.findByRoundIdAndWalletAddress(1L, WALLET_A)).thenReturn(Optional.of(existing));
        when(roundPositionRepository.save(existing)).thenReturn(existing);
        when(roundTokenFundingRepository.findByRoundIdAndTokenAddress(1L, SECONDARY_TOKEN))
                .thenReturn(Optional.of(funding(SECONDARY_TOKEN, 40)));

        fundingLedgerService.recordContribution(round, WALLET_A, SECONDARY_TOKEN, BigInteger.valueOf(10), NOW);

        assertEquals(BigInteger.valueOf(110), existing.getAmount());
        assertEquals(BigInteger.valueOf(10), existing.getSecondaryAmount());
        assertEquals(BigInteger.valueOf(100), existing.primaryAmount());
        assertEquals(BigInteger.valueOf(55).multiply(BigInteger.TEN.pow(18)), existing.getTokenAllocation());
        assertEquals(BigInteger.valueOf(110), round.getFundedUsdValue());
    }

    private static RoundTokenFunding funding(String token, long total) {
        RoundTokenFunding funding = new RoundTokenFunding();
        funding.setRoundId(1L);
        funding.setTokenAddress(token);
        funding.setTotalFunded(BigInteger.valueOf(total));
        return funding;
    }
}
