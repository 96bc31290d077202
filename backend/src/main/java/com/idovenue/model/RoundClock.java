package com.idovenue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Time windows and one-way flags of a round. Every ledger operation is gated on this clock.
 */
@Getter
@Setter
@Embeddable
public class RoundClock {

    @Column(name = "start_time", nullable = false)
    private OffsetDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private OffsetDateTime endTime;

    @Column(name = "initial_end_time", nullable = false, updatable = false)
    private OffsetDateTime initialEndTime;

    @Column(name = "claimable_time", nullable = false)
    private OffsetDateTime claimableTime;

    @Column(name = "initial_claimable_time", nullable = false, updatable = false)
    private OffsetDateTime initialClaimableTime;

    @Column(name = "end_time_delayed", nullable = false)
    private boolean endTimeDelayed;

    @Column(name = "claimable_time_delayed", nullable = false)
    private boolean claimableTimeDelayed;

    @Column(name = "finalized", nullable = false)
    private boolean finalized;

    @Column(name = "whitelist_enabled", nullable = false)
    private boolean whitelistEnabled;

    /**
     * Set once unsold inventory has left custody; the round takes no further contributions.
     */
    @Column(name = "spare_withdrawn", nullable = false)
    private boolean spareWithdrawn;

    public static RoundClock open(OffsetDateTime startTime,
                                  OffsetDateTime endTime,
                                  OffsetDateTime claimableTime,
                                  boolean whitelistEnabled) {
        RoundClock clock = new RoundClock();
        clock.setStartTime(startTime);
        clock.setEndTime(endTime);
        clock.setInitialEndTime(endTime);
        clock.setClaimableTime(claimableTime);
        clock.setInitialClaimableTime(claimableTime);
        clock.setWhitelistEnabled(whitelistEnabled);
        return clock;
    }

    public boolean hasStarted(OffsetDateTime now) {
        return !now.isBefore(startTime);
    }

    public boolean hasEnded(OffsetDateTime now) {
        return !now.isBefore(endTime);
    }

    public boolean isClaimable(OffsetDateTime now) {
        return finalized && !now.isBefore(claimableTime);
    }
}
