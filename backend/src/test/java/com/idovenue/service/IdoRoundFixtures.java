package com.idovenue.service;

import com.idovenue.model.IdoRound;
import com.idovenue.model.RoundClock;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class IdoRoundFixtures {

    public static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    public static final Clock CLOCK = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);

    public static final String OWNER = "0x0000000000000000000000000000000000000001";
    public static final String CUSTODY = "0x00000000000000000000000000000000000000c0";
    public static final String TREASURY = "0x00000000000000000000000000000000000000f0";
    public static final String IDO_TOKEN = "0x00000000000000000000000000000000000000aa";
    public static final String PRIMARY_TOKEN = "0x00000000000000000000000000000000000000bb";
    public static final String SECONDARY_TOKEN = "0x00000000000000000000000000000000000000cc";
    public static final String WALLET_A = "0x000000000000000000000000000000000000000a";
    public static final String WALLET_B = "0x000000000000000000000000000000000000000b";

    private IdoRoundFixtures() {
    }

    /**
     * Round with price 2, 18 sale decimals and 1000 whole sale tokens of inventory.
     */
    public static IdoRound round(long roundId, OffsetDateTime start, OffsetDateTime end, OffsetDateTime claimable) {
        IdoRound round = new IdoRound();
        round.setRoundId(roundId);
        round.setIdoToken(IDO_TOKEN);
        round.setIdoTokenDecimals(18);
        round.setPrimaryToken(PRIMARY_TOKEN);
        round.setSecondaryToken(SECONDARY_TOKEN);
        round.setIdoPrice(BigInteger.TWO);
        round.setIdoSize(BigInteger.valueOf(1_000).multiply(BigInteger.TEN.pow(18)));
        round.setMinimumFundingGoal(BigInteger.valueOf(500));
        round.setFundedUsdValue(BigInteger.ZERO);
        round.setSecondaryCapBps(2_500);
        round.setClock(RoundClock.open(start, end, claimable, false));
        round.setCreatedAt(NOW.minusDays(1));
        round.setUpdatedAt(NOW.minusDays(1));
        return round;
    }

    public static IdoRound upcomingRound(long roundId) {
        return round(roundId, NOW.plusHours(1), NOW.plusDays(1), NOW.plusDays(2));
    }

    public static IdoRound openRound(long roundId) {
        return round(roundId, NOW.minusHours(1), NOW.plusDays(1), NOW.plusDays(2));
    }

    public static IdoRound endedRound(long roundId) {
        return round(roundId, NOW.minusDays(2), NOW.minusHours(1), NOW.plusDays(1));
    }

    public static IdoRound claimableRound(long roundId) {
        IdoRound round = round(roundId, NOW.minusDays(3), NOW.minusDays(2), NOW.minusHours(1));
        round.getClock().setFinalized(true);
        return round;
    }
}
