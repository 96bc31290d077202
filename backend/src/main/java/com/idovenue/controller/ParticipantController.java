package com.idovenue.controller;

import com.idovenue.controller.dto.IdoRoundResponses;
import com.idovenue.service.RoundQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/participants")
public class ParticipantController {

    private final RoundQueryService roundQueryService;

    public ParticipantController(RoundQueryService roundQueryService) {
        this.roundQueryService = roundQueryService;
    }

    @GetMapping("/{wallet}/summary")
    public ResponseEntity<IdoRoundResponses.ParticipantSummary> summary(
            @PathVariable String wallet,
            @RequestParam(required = false) List<Long> roundIds
    ) {
        return ResponseEntity.ok(roundQueryService.participantSummary(wallet, roundIds));
    }
}
