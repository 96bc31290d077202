package com.idovenue.controller;

import com.idovenue.controller.dto.MetaIdoRequests;
import com.idovenue.controller.dto.MetaIdoResponses;
import com.idovenue.mapper.IdoResponseMapper;
import com.idovenue.model.MetaIdo;
import com.idovenue.service.MetaIdoService;
import com.idovenue.service.RoundQueryService;
import com.idovenue.web.CallerHeaders;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/meta-idos")
public class MetaIdoController {

    private final MetaIdoService metaIdoService;
    private final RoundQueryService roundQueryService;
    private final IdoResponseMapper idoResponseMapper;

    public MetaIdoController(MetaIdoService metaIdoService,
                             RoundQueryService roundQueryService,
                             IdoResponseMapper idoResponseMapper) {
        this.metaIdoService = metaIdoService;
        this.roundQueryService = roundQueryService;
        this.idoResponseMapper = idoResponseMapper;
    }

    @PostMapping
    public ResponseEntity<MetaIdoResponses.MetaIdoDetail> createMetaIdo(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller
    ) {
        MetaIdo metaIdo = metaIdoService.createMetaIdo(caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(idoResponseMapper.toMetaIdoDetail(metaIdo, 0));
    }

    @GetMapping("/{metaIdoId}")
    public ResponseEntity<MetaIdoResponses.MetaIdoDetail> getMetaIdo(@PathVariable Long metaIdoId) {
        return ResponseEntity.ok(roundQueryService.getMetaIdo(metaIdoId));
    }

    @PostMapping("/{metaIdoId}/rounds")
    public ResponseEntity<MetaIdoResponses.MetaIdoDetail> manageRound(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long metaIdoId,
            @Valid @RequestBody MetaIdoRequests.ManageRoundRequest request
    ) {
        metaIdoService.manageRoundInMetaIdo(caller, metaIdoId, request.roundId(), request.add());
        return ResponseEntity.ok(roundQueryService.getMetaIdo(metaIdoId));
    }

    @PostMapping("/{metaIdoId}/register")
    public ResponseEntity<MetaIdoResponses.ParticipantTier> register(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String participant,
            @PathVariable Long metaIdoId
    ) {
        return ResponseEntity.ok(idoResponseMapper.toParticipantTier(
                metaIdoService.registerForMetaIdo(participant, metaIdoId)));
    }

    @PutMapping("/{metaIdoId}/tiers")
    public ResponseEntity<List<MetaIdoResponses.ParticipantTier>> setParticipantTier(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long metaIdoId,
            @Valid @RequestBody MetaIdoRequests.ParticipantTierRequest request
    ) {
        return ResponseEntity.ok(idoResponseMapper.toParticipantTiers(metaIdoService.setParticipantTier(
                caller, metaIdoId, request.wallets(), request.rank(), request.multiplier())));
    }

    @GetMapping("/{metaIdoId}/participants/{wallet}")
    public ResponseEntity<MetaIdoResponses.ParticipantTier> getParticipantTier(
            @PathVariable Long metaIdoId,
            @PathVariable String wallet
    ) {
        return ResponseEntity.ok(roundQueryService.getParticipantTier(metaIdoId, wallet));
    }
}
