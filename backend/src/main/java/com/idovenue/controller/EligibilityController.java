package com.idovenue.controller;

import com.idovenue.controller.dto.EligibilityResponses;
import com.idovenue.service.EligibilityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/eligibility")
public class EligibilityController {

    private final EligibilityService eligibilityService;

    public EligibilityController(EligibilityService eligibilityService) {
        this.eligibilityService = eligibilityService;
    }

    @GetMapping
    public ResponseEntity<List<EligibilityResponses.RoundEligibility>> project(
            @RequestParam String wallet,
            @RequestParam List<Long> roundIds
    ) {
        return ResponseEntity.ok(eligibilityService.project(wallet, roundIds));
    }
}
