package com.idovenue.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IdoVenueExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(IdoVenueExceptionHandler.class);

    @ExceptionHandler(IdoVenueException.class)
    public ResponseEntity<IdoVenueErrorResponse> handle(IdoVenueException ex) {
        if (ex.getCategory() == IdoErrorCategory.AUTHORIZATION) {
            log.warn("Rejected venue call ({}): {}", ex.getCode(), ex.getMessage());
        } else {
            log.debug("Venue call failed ({}): {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new IdoVenueErrorResponse(ex.getCode().name(), ex.getCategory().name(), ex.getMessage()));
    }

    public record IdoVenueErrorResponse(
            String code,
            String category,
            String message
    ) {
    }
}
