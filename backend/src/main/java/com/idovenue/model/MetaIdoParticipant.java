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
@Table(name = "meta_ido_participant",
        uniqueConstraints = @UniqueConstraint(columnNames = {"meta_ido_id", "wallet_address"}))
public class MetaIdoParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "participant_id")
    private Long participantId;

    @Column(name = "meta_ido_id", nullable = false, updatable = false)
    private Long metaIdoId;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 128)
    private String walletAddress;

    @Column(name = "registered", nullable = false)
    private boolean registered;

    @Column(name = "tier_rank", nullable = false)
    private int rank;

    @Column(name = "tier_multiplier", nullable = false, precision = 78, scale = 0)
    private BigInteger multiplier = BigInteger.ZERO;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
