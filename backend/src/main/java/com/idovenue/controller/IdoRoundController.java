package com.idovenue.controller;

import com.idovenue.controller.dto.IdoRoundRequests;
import com.idovenue.controller.dto.IdoRoundResponses;
import com.idovenue.mapper.IdoResponseMapper;
import com.idovenue.model.IdoRound;
import com.idovenue.service.ParticipationService;
import com.idovenue.service.RoundManagerService;
import com.idovenue.service.RoundQueryService;
import com.idovenue.service.SettlementService;
import com.idovenue.service.WalletAddresses;
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

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/rounds")
public class IdoRoundController {

    private final RoundManagerService roundManagerService;
    private final ParticipationService participationService;
    private final SettlementService settlementService;
    private final RoundQueryService roundQueryService;
    private final IdoResponseMapper idoResponseMapper;

    public IdoRoundController(RoundManagerService roundManagerService,
                              ParticipationService participationService,
                              SettlementService settlementService,
                              RoundQueryService roundQueryService,
                              IdoResponseMapper idoResponseMapper) {
        this.roundManagerService = roundManagerService;
        this.participationService = participationService;
        this.settlementService = settlementService;
        this.roundQueryService = roundQueryService;
        this.idoResponseMapper = idoResponseMapper;
    }

    @PostMapping
    public ResponseEntity<IdoRoundResponses.RoundSummary> createRound(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @Valid @RequestBody IdoRoundRequests.CreateRoundRequest request
    ) {
        IdoRound round = roundManagerService.createRound(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(idoResponseMapper.toRoundSummary(round));
    }

    @GetMapping
    public ResponseEntity<List<IdoRoundResponses.RoundSummary>> listRounds() {
        return ResponseEntity.ok(roundQueryService.listRounds());
    }

    @GetMapping("/{roundId}")
    public ResponseEntity<IdoRoundResponses.RoundDetail> getRound(@PathVariable Long roundId) {
        return ResponseEntity.ok(roundQueryService.getRound(roundId));
    }

    @PostMapping("/{roundId}/finalize")
    public ResponseEntity<IdoRoundResponses.RoundSummary> finalizeRound(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId
    ) {
        return ResponseEntity.ok(idoResponseMapper.toRoundSummary(roundManagerService.finalizeRound(caller, roundId)));
    }

    @PutMapping("/{roundId}/end-time")
    public ResponseEntity<IdoRoundResponses.RoundSummary> delayEndTime(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.DelayRequest request
    ) {
        IdoRound round = roundManagerService.delayEndTime(caller, roundId, request.newTime());
        return ResponseEntity.ok(idoResponseMapper.toRoundSummary(round));
    }

    @PutMapping("/{roundId}/claimable-time")
    public ResponseEntity<IdoRoundResponses.RoundSummary> delayClaimableTime(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.DelayRequest request
    ) {
        IdoRound round = roundManagerService.delayClaimableTime(caller, roundId, request.newTime());
        return ResponseEntity.ok(idoResponseMapper.toRoundSummary(round));
    }

    @PutMapping("/{roundId}/whitelist/status")
    public ResponseEntity<IdoRoundResponses.RoundSummary> setWhitelistStatus(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.WhitelistStatusRequest request
    ) {
        IdoRound round = roundManagerService.setWhitelistStatus(caller, roundId, request.enabled());
        return ResponseEntity.ok(idoResponseMapper.toRoundSummary(round));
    }

    @PostMapping("/{roundId}/whitelist")
    public ResponseEntity<IdoRoundResponses.WhitelistUpdate> modifyWhitelist(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.ModifyWhitelistRequest request
    ) {
        int changed = roundManagerService.modifyWhitelist(caller, roundId, request.addresses(), request.add());
        return ResponseEntity.ok(new IdoRoundResponses.WhitelistUpdate(roundId, request.add(), changed));
    }

    @GetMapping("/{roundId}/whitelist/{wallet}")
    public ResponseEntity<IdoRoundResponses.WhitelistStatus> isWhitelisted(
            @PathVariable Long roundId,
            @PathVariable String wallet
    ) {
        return ResponseEntity.ok(roundQueryService.isWhitelisted(roundId, wallet));
    }

    @PutMapping("/{roundId}/secondary-cap")
    public ResponseEntity<IdoRoundResponses.RoundSummary> setSecondaryCap(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.SecondaryCapRequest request
    ) {
        IdoRound round = roundManagerService.setFyTokenMaxBasisPoints(caller, roundId, request.basisPoints());
        return ResponseEntity.ok(idoResponseMapper.toRoundSummary(round));
    }

    @PutMapping("/{roundId}/spec")
    public ResponseEntity<IdoRoundResponses.RoundSpec> setRoundSpec(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.RoundSpecRequest request
    ) {
        IdoRound round = roundManagerService.setRoundSpec(caller, roundId, request);
        return ResponseEntity.ok(idoResponseMapper.toRoundSpec(round.getSpec()));
    }

    @PostMapping("/{roundId}/inventory")
    public ResponseEntity<IdoRoundResponses.InventoryBalance> depositInventory(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.DepositInventoryRequest request
    ) {
        BigInteger held = roundManagerService.depositInventory(caller, roundId, request.amount());
        return ResponseEntity.ok(new IdoRoundResponses.InventoryBalance(roundId, request.amount(), held));
    }

    @PostMapping("/{roundId}/participate")
    public ResponseEntity<IdoRoundResponses.ParticipationReceipt> participate(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String participant,
            @PathVariable Long roundId,
            @Valid @RequestBody IdoRoundRequests.ParticipateRequest request
    ) {
        ParticipationService.ParticipationResult result =
                participationService.participate(participant, roundId, request.token(), request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(idoResponseMapper.toParticipationReceipt(result));
    }

    @PostMapping("/{roundId}/claim")
    public ResponseEntity<IdoRoundResponses.ClaimReceipt> claim(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String participant,
            @PathVariable Long roundId
    ) {
        return ResponseEntity.ok(idoResponseMapper.toClaimReceipt(settlementService.claim(roundId, participant)));
    }

    @PostMapping("/{roundId}/withdraw-spare")
    public ResponseEntity<IdoRoundResponses.SpareWithdrawal> withdrawSpareTokens(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @PathVariable Long roundId
    ) {
        BigInteger spare = settlementService.withdrawSpareTokens(caller, roundId);
        return ResponseEntity.ok(new IdoRoundResponses.SpareWithdrawal(roundId, WalletAddresses.normalize(caller), spare));
    }

    @GetMapping("/{roundId}/positions/{wallet}")
    public ResponseEntity<IdoRoundResponses.Position> getPosition(
            @PathVariable Long roundId,
            @PathVariable String wallet
    ) {
        return ResponseEntity.ok(roundQueryService.getPosition(roundId, wallet));
    }
}
