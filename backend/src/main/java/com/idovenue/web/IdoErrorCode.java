package com.idovenue.web;

public enum IdoErrorCode {
    NOT_STARTED(IdoErrorCategory.WINDOW),
    NOT_CLAIMABLE(IdoErrorCategory.WINDOW),
    IDO_NOT_ENDED(IdoErrorCategory.WINDOW),
    WINDOW_CLOSED(IdoErrorCategory.WINDOW),

    ALREADY_FINALIZED(IdoErrorCategory.STATE),
    WHITELIST_DISABLED(IdoErrorCategory.STATE),
    BALANCE_CONFLICT(IdoErrorCategory.STATE),

    INVALID_TOKEN(IdoErrorCategory.VALIDATION),
    INVALID_WINDOW(IdoErrorCategory.VALIDATION),
    INVALID_DELAY(IdoErrorCategory.VALIDATION),
    INVALID_BASIS_POINTS(IdoErrorCategory.VALIDATION),
    INVALID_AMOUNT(IdoErrorCategory.VALIDATION),
    INVALID_RANK_RANGE(IdoErrorCategory.VALIDATION),
    INVALID_ADDRESS(IdoErrorCategory.VALIDATION),
    EMPTY_ADDRESS_LIST(IdoErrorCategory.VALIDATION),

    UNAUTHORIZED(IdoErrorCategory.AUTHORIZATION),
    NOT_WHITELISTED(IdoErrorCategory.AUTHORIZATION),

    NO_POSITION(IdoErrorCategory.LEDGER),
    SECONDARY_CAP_EXCEEDED(IdoErrorCategory.LEDGER),
    FUNDING_GOAL_NOT_REACHED(IdoErrorCategory.LEDGER),
    FUNDING_GOAL_REACHED(IdoErrorCategory.LEDGER),
    NO_SPARE_TOKENS(IdoErrorCategory.LEDGER),
    INSUFFICIENT_BALANCE(IdoErrorCategory.LEDGER),

    ROUND_NOT_FOUND(IdoErrorCategory.LOOKUP),
    META_IDO_NOT_FOUND(IdoErrorCategory.LOOKUP),
    ROUND_NOT_IN_META_IDO(IdoErrorCategory.LOOKUP),
    ROUND_ALREADY_IN_META_IDO(IdoErrorCategory.STATE);

    private final IdoErrorCategory category;

    IdoErrorCode(IdoErrorCategory category) {
        this.category = category;
    }

    public IdoErrorCategory category() {
        return category;
    }
}
