package com.idovenue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;

/**
 * Rank and allocation policy used by the eligibility projection. An uninitialized spec
 * leaves the round open to everyone.
 */
@Getter
@Setter
@Embeddable
public class RoundSpec {

    @Column(name = "specs_initialized", nullable = false)
    private boolean specsInitialized;

    @Column(name = "min_rank", nullable = false)
    private int minRank;

    @Column(name = "max_rank", nullable = false)
    private int maxRank;

    @Column(name = "no_rank", nullable = false)
    private boolean noRank;

    @Column(name = "max_alloc", nullable = false, precision = 78, scale = 0)
    private BigInteger maxAlloc = BigInteger.ZERO;

    @Column(name = "max_alloc_multiplier", nullable = false, precision = 78, scale = 0)
    private BigInteger maxAllocMultiplier = BigInteger.ZERO;

    @Column(name = "no_multiplier", nullable = false)
    private boolean noMultiplier;
}
