package com.idovenue.service;

import com.idovenue.config.IdoVenueProperties;
import com.idovenue.controller.dto.IdoRoundRequests;
import com.idovenue.event.IdoEvents;
import com.idovenue.gateway.OwnershipGate;
import com.idovenue.gateway.TokenMetadataGateway;
import com.idovenue.gateway.TokenTransferGateway;
import com.idovenue.model.IdSequence;
import com.idovenue.model.IdoRound;
import com.idovenue.model.RoundClock;
import com.idovenue.model.RoundSpec;
import com.idovenue.model.RoundWhitelistEntry;
import com.idovenue.repository.IdoRoundRepository;
import com.idovenue.repository.RoundWhitelistEntryRepository;
import com.idovenue.web.IdoVenueException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Round lifecycle: creation, finalization, time-window delays, whitelist and cap settings.
 * Lifecycle per round: created -> open (now >= start) -> ended (now >= end) -> finalized,
 * and claims unlock once now >= claimableTime. Finalization is one-way.
 */
@Service
@RequiredArgsConstructor
public class RoundManagerService {

    private static final Logger log = LoggerFactory.getLogger(RoundManagerService.class);

    private final IdoRoundRepository idoRoundRepository;
    private final RoundWhitelistEntryRepository roundWhitelistEntryRepository;
    private final FundingLedgerService fundingLedgerService;
    private final IdSequenceService idSequenceService;
    private final TokenMetadataGateway tokenMetadataGateway;
    private final TokenTransferGateway tokenTransferGateway;
    private final OwnershipGate ownershipGate;
    private final IdoVenueProperties idoVenueProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    @Transactional
    public IdoRound createRound(String caller, IdoRoundRequests.CreateRoundRequest request) {
        ownershipGate.requireOwner(caller);

        OffsetDateTime startTime = request.startTime();
        OffsetDateTime endTime = request.endTime();
        OffsetDateTime claimableTime = request.claimableTime();
        if (!endTime.isAfter(startTime)) {
            throw IdoVenueException.invalidWindow("endTime must be after startTime");
        }
        if (!claimableTime.isAfter(endTime)) {
            throw IdoVenueException.invalidWindow("claimableTime must be after endTime");
        }

        String idoToken = WalletAddresses.normalize(request.idoToken());
        String primaryToken = WalletAddresses.normalize(request.primaryToken());
        String secondaryToken = WalletAddresses.normalize(request.secondaryToken());
        if (primaryToken.equals(secondaryToken)) {
            throw IdoVenueException.invalidToken("primaryToken and secondaryToken must differ");
        }
        if (request.idoPrice() == null || request.idoPrice().signum() <= 0) {
            throw IdoVenueException.invalidAmount("idoPrice must be positive");
        }
        if (request.idoSize().signum() < 0 || request.minimumFundingGoal().signum() < 0) {
            throw IdoVenueException.invalidAmount("idoSize and minimumFundingGoal must be non-negative");
        }
        int secondaryCapBps = request.secondaryCapBps() != null ? request.secondaryCapBps() : 0;
        if (!AllocationMath.isValidBasisPoints(secondaryCapBps)) {
            throw IdoVenueException.invalidBasisPoints(secondaryCapBps);
        }

        long roundId = idSequenceService.next(IdSequence.ROUND);
        int idoTokenDecimals = tokenMetadataGateway.decimals(idoToken);
        OffsetDateTime now = now();

        IdoRound round = new IdoRound();
        round.setRoundId(roundId);
        round.setIdoToken(idoToken);
        round.setIdoTokenDecimals(idoTokenDecimals);
        round.setPrimaryToken(primaryToken);
        round.setSecondaryToken(secondaryToken);
        round.setIdoPrice(request.idoPrice());
        round.setIdoSize(request.idoSize());
        round.setMinimumFundingGoal(request.minimumFundingGoal());
        round.setFundedUsdValue(BigInteger.ZERO);
        round.setSecondaryCapBps(secondaryCapBps);
        round.setClock(RoundClock.open(startTime, endTime, claimableTime,
                Boolean.TRUE.equals(request.whitelistEnabled())));
        round.setSpec(new RoundSpec());
        round.setCreatedAt(now);
        round.setUpdatedAt(now);
        IdoRound saved = idoRoundRepository.save(round);

        applicationEventPublisher.publishEvent(new IdoEvents.RoundCreated(
                roundId, idoToken, idoTokenDecimals, primaryToken, secondaryToken,
                saved.getIdoPrice(), saved.getIdoSize(), saved.getMinimumFundingGoal(), secondaryCapBps,
                startTime, endTime, claimableTime, saved.getClock().isWhitelistEnabled()));
        return saved;
    }

    /**
     * Freezes size and raised value. Size is re-read from custody so it reflects the inventory
     * actually deposited rather than the nominal figure.
     */
    @Transactional
    public IdoRound finalizeRound(String caller, Long roundId) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        RoundClock roundClock = round.getClock();
        if (roundClock.isFinalized()) {
            throw IdoVenueException.alreadyFinalized(roundId);
        }
        OffsetDateTime now = now();
        if (!roundClock.hasEnded(now)) {
            throw IdoVenueException.idoNotEnded(roundId);
        }

        BigInteger idoSize = tokenMetadataGateway.balanceOf(idoVenueProperties.getCustodyAddress(), round.getIdoToken());
        BigInteger fundedUsdValue = fundingLedgerService.totalRaised(round);
        if (fundedUsdValue.compareTo(round.getMinimumFundingGoal()) < 0) {
            throw IdoVenueException.fundingGoalNotReached(roundId,
                    "raised " + fundedUsdValue + " of " + round.getMinimumFundingGoal());
        }

        round.setIdoSize(idoSize);
        round.setFundedUsdValue(fundedUsdValue);
        roundClock.setFinalized(true);
        round.setUpdatedAt(now);
        IdoRound saved = idoRoundRepository.save(round);

        applicationEventPublisher.publishEvent(new IdoEvents.RoundFinalized(roundId, idoSize, fundedUsdValue));
        return saved;
    }

    @Transactional
    public IdoRound delayEndTime(String caller, Long roundId, OffsetDateTime newEndTime) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        RoundClock roundClock = round.getClock();
        if (roundClock.isFinalized()) {
            throw IdoVenueException.alreadyFinalized(roundId);
        }
        if (roundClock.isEndTimeDelayed() && newEndTime.isEqual(roundClock.getEndTime())) {
            log.debug("Round {} end time already delayed to {}", roundId, newEndTime);
            return round;
        }
        if (roundClock.isEndTimeDelayed()) {
            throw IdoVenueException.invalidDelay("End time of round " + roundId + " was already delayed");
        }
        if (!newEndTime.isAfter(roundClock.getEndTime())) {
            throw IdoVenueException.invalidDelay("New end time must be after " + roundClock.getEndTime());
        }
        OffsetDateTime limit = roundClock.getInitialEndTime().plus(idoVenueProperties.getDelay().getMaxDelay());
        if (newEndTime.isAfter(limit)) {
            throw IdoVenueException.invalidDelay("New end time must not be after " + limit);
        }
        if (!newEndTime.isBefore(roundClock.getClaimableTime())) {
            throw IdoVenueException.invalidDelay("New end time must be before claimable time " + roundClock.getClaimableTime());
        }

        OffsetDateTime previous = roundClock.getEndTime();
        roundClock.setEndTime(newEndTime);
        roundClock.setEndTimeDelayed(true);
        round.setUpdatedAt(now());
        IdoRound saved = idoRoundRepository.save(round);

        applicationEventPublisher.publishEvent(new IdoEvents.EndTimeDelayed(roundId, previous, newEndTime));
        return saved;
    }

    @Transactional
    public IdoRound delayClaimableTime(String caller, Long roundId, OffsetDateTime newClaimableTime) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        RoundClock roundClock = round.getClock();
        if (roundClock.isClaimableTimeDelayed() && newClaimableTime.isEqual(roundClock.getClaimableTime())) {
            log.debug("Round {} claimable time already delayed to {}", roundId, newClaimableTime);
            return round;
        }
        if (roundClock.isClaimableTimeDelayed()) {
            throw IdoVenueException.invalidDelay("Claimable time of round " + roundId + " was already delayed");
        }
        if (!newClaimableTime.isAfter(roundClock.getClaimableTime())
                || !newClaimableTime.isAfter(roundClock.getEndTime())) {
            throw IdoVenueException.invalidDelay(
                    "New claimable time must be after " + roundClock.getClaimableTime() + " and after end time");
        }
        OffsetDateTime limit = roundClock.getInitialClaimableTime().plus(idoVenueProperties.getDelay().getMaxDelay());
        if (newClaimableTime.isAfter(limit)) {
            throw IdoVenueException.invalidDelay("New claimable time must not be after " + limit);
        }

        OffsetDateTime previous = roundClock.getClaimableTime();
        roundClock.setClaimableTime(newClaimableTime);
        roundClock.setClaimableTimeDelayed(true);
        round.setUpdatedAt(now());
        IdoRound saved = idoRoundRepository.save(round);

        applicationEventPublisher.publishEvent(new IdoEvents.ClaimableTimeDelayed(roundId, previous, newClaimableTime));
        return saved;
    }

    /**
     * Enabling is only possible before the round opens; disabling is allowed until finalization.
     */
    @Transactional
    public IdoRound setWhitelistStatus(String caller, Long roundId, boolean enabled) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        RoundClock roundClock = round.getClock();
        OffsetDateTime now = now();

        if (enabled) {
            if (roundClock.hasStarted(now)) {
                throw IdoVenueException.windowClosed(roundId, "whitelist can no longer be enabled");
            }
            if (roundClock.isWhitelistEnabled()) {
                log.debug("Round {} whitelist already enabled", roundId);
                return round;
            }
        } else {
            if (roundClock.isFinalized()) {
                throw IdoVenueException.alreadyFinalized(roundId);
            }
            if (!roundClock.isWhitelistEnabled()) {
                throw IdoVenueException.whitelistDisabled(roundId);
            }
        }

        roundClock.setWhitelistEnabled(enabled);
        round.setUpdatedAt(now);
        IdoRound saved = idoRoundRepository.save(round);

        applicationEventPublisher.publishEvent(new IdoEvents.WhitelistStatusChanged(roundId, enabled));
        return saved;
    }

    /**
     * @return number of addresses whose membership actually changed
     */
    @Transactional
    public int modifyWhitelist(String caller, Long roundId, List<String> addresses, boolean add) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        if (round.getClock().isFinalized()) {
            throw IdoVenueException.alreadyFinalized(roundId);
        }
        if (!round.getClock().isWhitelistEnabled()) {
            throw IdoVenueException.whitelistDisabled(roundId);
        }
        if (addresses == null || addresses.isEmpty()) {
            throw IdoVenueException.emptyAddressList();
        }

        Set<String> wallets = new LinkedHashSet<>();
        for (String address : addresses) {
            wallets.add(WalletAddresses.normalize(address));
        }

        OffsetDateTime now = now();
        int changed = 0;
        for (String wallet : wallets) {
            boolean listed = roundWhitelistEntryRepository.existsByRoundIdAndWalletAddress(roundId, wallet);
            if (add && !listed) {
                RoundWhitelistEntry entry = new RoundWhitelistEntry();
                entry.setRoundId(roundId);
                entry.setWalletAddress(wallet);
                entry.setCreatedAt(now);
                roundWhitelistEntryRepository.save(entry);
                changed++;
            } else if (!add && listed) {
                roundWhitelistEntryRepository.deleteByRoundIdAndWalletAddress(roundId, wallet);
                changed++;
            }
        }

        log.info("Round {} whitelist {} {} of {} address(es)",
                roundId, add ? "added" : "removed", changed, wallets.size());
        return changed;
    }

    @Transactional
    public IdoRound setFyTokenMaxBasisPoints(String caller, Long roundId, int basisPoints) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        if (!AllocationMath.isValidBasisPoints(basisPoints)) {
            throw IdoVenueException.invalidBasisPoints(basisPoints);
        }
        OffsetDateTime now = now();
        if (round.getClock().hasStarted(now)) {
            throw IdoVenueException.windowClosed(roundId, "secondary token cap is locked");
        }

        round.setSecondaryCapBps(basisPoints);
        round.setUpdatedAt(now);
        IdoRound saved = idoRoundRepository.save(round);

        applicationEventPublisher.publishEvent(new IdoEvents.BasisPointsChanged(roundId, basisPoints));
        return saved;
    }

    @Transactional
    public IdoRound setRoundSpec(String caller, Long roundId, IdoRoundRequests.RoundSpecRequest request) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        OffsetDateTime now = now();
        if (round.getClock().hasStarted(now)) {
            throw IdoVenueException.windowClosed(roundId, "round spec is locked");
        }
        if (!request.noRank() && request.minRank() > request.maxRank()) {
            throw IdoVenueException.invalidRankRange(request.minRank(), request.maxRank());
        }

        RoundSpec spec = new RoundSpec();
        spec.setSpecsInitialized(true);
        spec.setMinRank(request.minRank());
        spec.setMaxRank(request.maxRank());
        spec.setNoRank(request.noRank());
        spec.setMaxAlloc(request.maxAlloc());
        spec.setMaxAllocMultiplier(request.maxAllocMultiplier());
        spec.setNoMultiplier(request.noMultiplier());
        round.setSpec(spec);
        round.setUpdatedAt(now);

        log.info("Round {} spec set: ranks [{}, {}] noRank={} maxAlloc={} noMultiplier={}",
                roundId, spec.getMinRank(), spec.getMaxRank(), spec.isNoRank(), spec.getMaxAlloc(), spec.isNoMultiplier());
        return idoRoundRepository.save(round);
    }

    /**
     * Moves sale-token inventory from the caller into custody ahead of finalization.
     */
    @Transactional
    public BigInteger depositInventory(String caller, Long roundId, BigInteger amount) {
        ownershipGate.requireOwner(caller);
        IdoRound round = lockRound(roundId);
        if (round.getClock().isFinalized()) {
            throw IdoVenueException.alreadyFinalized(roundId);
        }
        if (amount == null || amount.signum() <= 0) {
            throw IdoVenueException.invalidAmount("Deposit amount must be positive");
        }
        tokenTransferGateway.pull(round.getIdoToken(), WalletAddresses.normalize(caller), amount);
        BigInteger held = tokenMetadataGateway.balanceOf(idoVenueProperties.getCustodyAddress(), round.getIdoToken());
        log.info("Round {} inventory deposit of {} {}, custody now holds {}", roundId, amount, round.getIdoToken(), held);
        return held;
    }

    private IdoRound lockRound(Long roundId) {
        return idoRoundRepository.findByRoundIdForUpdate(roundId)
                .orElseThrow(() -> IdoVenueException.roundNotFound(roundId));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
