package com.idovenue.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Aborts the current venue operation. Thrown inside a transaction, it rolls back every
 * ledger and custody change made so far.
 */
@Getter
public class IdoVenueException extends RuntimeException {

    private final IdoErrorCode code;

    public IdoVenueException(IdoErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public IdoErrorCategory getCategory() {
        return code.category();
    }

    public HttpStatus getStatus() {
        return code.category().status();
    }

    public static IdoVenueException notStarted(long roundId) {
        return new IdoVenueException(IdoErrorCode.NOT_STARTED, "Round has not started: " + roundId);
    }

    public static IdoVenueException notClaimable(long roundId) {
        return new IdoVenueException(IdoErrorCode.NOT_CLAIMABLE, "Round is not claimable yet: " + roundId);
    }

    public static IdoVenueException idoNotEnded(long roundId) {
        return new IdoVenueException(IdoErrorCode.IDO_NOT_ENDED, "Round has not ended: " + roundId);
    }

    public static IdoVenueException windowClosed(long roundId, String detail) {
        return new IdoVenueException(IdoErrorCode.WINDOW_CLOSED,
                "Round " + roundId + " has already started: " + detail);
    }

    public static IdoVenueException contributionsClosed(long roundId, String detail) {
        return new IdoVenueException(IdoErrorCode.WINDOW_CLOSED,
                "Round " + roundId + " no longer accepts contributions: " + detail);
    }

    public static IdoVenueException alreadyFinalized(long roundId) {
        return new IdoVenueException(IdoErrorCode.ALREADY_FINALIZED, "Round is already finalized: " + roundId);
    }

    public static IdoVenueException whitelistDisabled(long roundId) {
        return new IdoVenueException(IdoErrorCode.WHITELIST_DISABLED, "Whitelist is not enabled for round: " + roundId);
    }

    public static IdoVenueException invalidToken(String detail) {
        return new IdoVenueException(IdoErrorCode.INVALID_TOKEN, detail);
    }

    public static IdoVenueException invalidWindow(String detail) {
        return new IdoVenueException(IdoErrorCode.INVALID_WINDOW, detail);
    }

    public static IdoVenueException invalidDelay(String detail) {
        return new IdoVenueException(IdoErrorCode.INVALID_DELAY, detail);
    }

    public static IdoVenueException invalidBasisPoints(int bps) {
        return new IdoVenueException(IdoErrorCode.INVALID_BASIS_POINTS,
                "Basis points must be between 0 and 10000: " + bps);
    }

    public static IdoVenueException invalidAmount(String detail) {
        return new IdoVenueException(IdoErrorCode.INVALID_AMOUNT, detail);
    }

    public static IdoVenueException invalidRankRange(int minRank, int maxRank) {
        return new IdoVenueException(IdoErrorCode.INVALID_RANK_RANGE,
                "minRank " + minRank + " is greater than maxRank " + maxRank);
    }

    public static IdoVenueException invalidAddress(String detail) {
        return new IdoVenueException(IdoErrorCode.INVALID_ADDRESS, detail);
    }

    public static IdoVenueException emptyAddressList() {
        return new IdoVenueException(IdoErrorCode.EMPTY_ADDRESS_LIST, "Address list must not be empty");
    }

    public static IdoVenueException unauthorized(String caller) {
        return new IdoVenueException(IdoErrorCode.UNAUTHORIZED, "Caller is not the venue owner: " + caller);
    }

    public static IdoVenueException notWhitelisted(long roundId, String wallet) {
        return new IdoVenueException(IdoErrorCode.NOT_WHITELISTED,
                "Wallet " + wallet + " is not whitelisted for round " + roundId);
    }

    public static IdoVenueException noPosition(long roundId, String wallet) {
        return new IdoVenueException(IdoErrorCode.NO_POSITION,
                "Wallet " + wallet + " has no position in round " + roundId);
    }

    public static IdoVenueException secondaryCapExceeded(long roundId, String detail) {
        return new IdoVenueException(IdoErrorCode.SECONDARY_CAP_EXCEEDED,
                "Secondary token cap exceeded for round " + roundId + ": " + detail);
    }

    public static IdoVenueException fundingGoalNotReached(long roundId, String detail) {
        return new IdoVenueException(IdoErrorCode.FUNDING_GOAL_NOT_REACHED,
                "Funding goal not reached for round " + roundId + ": " + detail);
    }

    public static IdoVenueException fundingGoalReached(long roundId, String detail) {
        return new IdoVenueException(IdoErrorCode.FUNDING_GOAL_REACHED,
                "Funding goal reached for round " + roundId + ", no spare tokens to withdraw: " + detail);
    }

    public static IdoVenueException noSpareTokens(long roundId) {
        return new IdoVenueException(IdoErrorCode.NO_SPARE_TOKENS, "No spare tokens held for round: " + roundId);
    }

    public static IdoVenueException insufficientBalance(String token, String holder, String detail) {
        return new IdoVenueException(IdoErrorCode.INSUFFICIENT_BALANCE,
                "Insufficient " + token + " balance for " + holder + ": " + detail);
    }

    public static IdoVenueException balanceConflict(String token, String holder) {
        return new IdoVenueException(IdoErrorCode.BALANCE_CONFLICT,
                "Concurrent update of " + token + " balance for " + holder + ", retry the request");
    }

    public static IdoVenueException roundNotFound(long roundId) {
        return new IdoVenueException(IdoErrorCode.ROUND_NOT_FOUND, "Round not found: " + roundId);
    }

    public static IdoVenueException metaIdoNotFound(long metaIdoId) {
        return new IdoVenueException(IdoErrorCode.META_IDO_NOT_FOUND, "MetaIDO not found: " + metaIdoId);
    }

    public static IdoVenueException roundNotInMetaIdo(long metaIdoId, long roundId) {
        return new IdoVenueException(IdoErrorCode.ROUND_NOT_IN_META_IDO,
                "Round " + roundId + " is not a member of MetaIDO " + metaIdoId);
    }

    public static IdoVenueException roundAlreadyInMetaIdo(long roundId, long parentMetaIdoId) {
        return new IdoVenueException(IdoErrorCode.ROUND_ALREADY_IN_META_IDO,
                "Round " + roundId + " already belongs to MetaIDO " + parentMetaIdoId);
    }
}
