package com.idovenue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;

@Getter
@Setter
@Entity
@Table(name = "round_token_funding",
        uniqueConstraints = @UniqueConstraint(columnNames = {"round_id", "token_address"}))
public class RoundTokenFunding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "funding_id")
    private Long fundingId;

    @Column(name = "round_id", nullable = false, updatable = false)
    private Long roundId;

    @Column(name = "token_address", nullable = false, updatable = false, length = 128)
    private String tokenAddress;

    @Column(name = "total_funded", nullable = false, precision = 78, scale = 0)
    private BigInteger totalFunded = BigInteger.ZERO;
}
