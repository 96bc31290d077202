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

/**
 * A participant's cumulative contribution to one round and the sale tokens it entitles them to.
 */
@Getter
@Setter
@Entity
@Table(name = "round_position",
        uniqueConstraints = @UniqueConstraint(columnNames = {"round_id", "wallet_address"}))
public class RoundPosition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "position_id")
    private Long positionId;

    @Column(name = "round_id", nullable = false, updatable = false)
    private Long roundId;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 128)
    private String walletAddress;

    @Column(name = "amount", nullable = false, precision = 78, scale = 0)
    private BigInteger amount = BigInteger.ZERO;

    @Column(name = "secondary_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger secondaryAmount = BigInteger.ZERO;

    @Column(name = "token_allocation", nullable = false, precision = 78, scale = 0)
    private BigInteger tokenAllocation = BigInteger.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public BigInteger primaryAmount() {
        return amount.subtract(secondaryAmount);
    }
}
