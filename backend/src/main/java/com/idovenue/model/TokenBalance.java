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
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "token_balance",
        uniqueConstraints = @UniqueConstraint(columnNames = {"token_address", "holder_address"}))
public class TokenBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "balance_id")
    private Long balanceId;

    @Column(name = "token_address", nullable = false, updatable = false, length = 128)
    private String tokenAddress;

    @Column(name = "holder_address", nullable = false, updatable = false, length = 128)
    private String holderAddress;

    @Column(name = "balance", nullable = false, precision = 78, scale = 0)
    private BigInteger balance = BigInteger.ZERO;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
