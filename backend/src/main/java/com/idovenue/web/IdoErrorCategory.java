package com.idovenue.web;

import org.springframework.http.HttpStatus;

public enum IdoErrorCategory {
    WINDOW(HttpStatus.CONFLICT),
    STATE(HttpStatus.CONFLICT),
    VALIDATION(HttpStatus.BAD_REQUEST),
    AUTHORIZATION(HttpStatus.FORBIDDEN),
    LEDGER(HttpStatus.UNPROCESSABLE_ENTITY),
    LOOKUP(HttpStatus.NOT_FOUND);

    private final HttpStatus status;

    IdoErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
