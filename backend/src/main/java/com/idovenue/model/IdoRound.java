package com.idovenue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "ido_round")
public class IdoRound {

    @Id
    @Column(name = "round_id", nullable = false, updatable = false)
    private Long roundId;

    @Column(name = "ido_token", nullable = false, updatable = false, length = 128)
    private String idoToken;

    @Column(name = "ido_token_decimals", nullable = false, updatable = false)
    private int idoTokenDecimals;

    @Column(name = "primary_token", nullable = false, updatable = false, length = 128)
    private String primaryToken;

    @Column(name = "secondary_token", nullable = false, updatable = false, length = 128)
    private String secondaryToken;

    @Column(name = "ido_price", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger idoPrice;

    @Column(name = "ido_size", nullable = false, precision = 78, scale = 0)
    private BigInteger idoSize = BigInteger.ZERO;

    @Column(name = "minimum_funding_goal", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger minimumFundingGoal = BigInteger.ZERO;

    @Column(name = "funded_usd_value", nullable = false, precision = 78, scale = 0)
    private BigInteger fundedUsdValue = BigInteger.ZERO;

    @Column(name = "secondary_cap_bps", nullable = false)
    private int secondaryCapBps;

    @Column(name = "parent_meta_ido_id")
    private Long parentMetaIdoId;

    @Embedded
    private RoundClock clock = new RoundClock();

    @Embedded
    private RoundSpec spec = new RoundSpec();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public boolean acceptsToken(String token) {
        return primaryToken.equals(token) || secondaryToken.equals(token);
    }

    public boolean isSecondaryToken(String token) {
        return secondaryToken.equals(token);
    }
}
