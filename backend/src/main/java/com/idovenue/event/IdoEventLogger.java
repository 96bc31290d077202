package com.idovenue.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes committed venue events to the application log.
 */
@Component
public class IdoEventLogger {

    private static final Logger log = LoggerFactory.getLogger(IdoEventLogger.class);

    @TransactionalEventListener(fallbackExecution = true)
    public void onRoundCreated(IdoEvents.RoundCreated event) {
        log.info("Round {} created: saleToken={} price={} size={} window=[{}, {}) claimable={}",
                event.roundId(), event.idoToken(), event.idoPrice(), event.idoSize(),
                event.startTime(), event.endTime(), event.claimableTime());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onRoundFinalized(IdoEvents.RoundFinalized event) {
        log.info("Round {} finalized: idoSize={} fundedUsdValue={}",
                event.roundId(), event.idoSize(), event.fundedUsdValue());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onParticipation(IdoEvents.ParticipationRecorded event) {
        log.info("Round {} participation: {} paid {} {} for allocation {}",
                event.roundId(), event.participant(), event.amount(), event.token(), event.allocation());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onClaimed(IdoEvents.Claimed event) {
        log.info("Round {} claimed by {}: allocation {}",
                event.roundId(), event.participant(), event.tokenAllocation());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onClaimableTimeDelayed(IdoEvents.ClaimableTimeDelayed event) {
        log.info("Round {} claimable time delayed {} -> {}",
                event.roundId(), event.previousClaimableTime(), event.claimableTime());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onEndTimeDelayed(IdoEvents.EndTimeDelayed event) {
        log.info("Round {} end time delayed {} -> {}",
                event.roundId(), event.previousEndTime(), event.endTime());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onWhitelistStatusChanged(IdoEvents.WhitelistStatusChanged event) {
        log.info("Round {} whitelist enabled={}", event.roundId(), event.enabled());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onBasisPointsChanged(IdoEvents.BasisPointsChanged event) {
        log.info("Round {} secondary cap set to {} bps", event.roundId(), event.secondaryCapBps());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onSpareTokensWithdrawn(IdoEvents.SpareTokensWithdrawn event) {
        log.info("Round {} spare tokens withdrawn: {} to {}", event.roundId(), event.amount(), event.recipient());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onMetaIdoCreated(IdoEvents.MetaIdoCreated event) {
        log.info("MetaIDO {} created", event.metaIdoId());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onMetaIdoMembershipChanged(IdoEvents.MetaIdoMembershipChanged event) {
        log.info("MetaIDO {} {} round {}",
                event.metaIdoId(), event.added() ? "added" : "removed", event.roundId());
    }
}
