package com.idovenue.controller;

import com.idovenue.controller.dto.VaultRequests;
import com.idovenue.gateway.CustodialTokenVault;
import com.idovenue.gateway.OwnershipGate;
import com.idovenue.service.WalletAddresses;
import com.idovenue.web.CallerHeaders;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Balance administration for the database-backed vault. Only present in custodial mode.
 */
@RestController
@RequestMapping("/api/vault")
@ConditionalOnProperty(
        prefix = "ido.vault",
        name = "mode",
        havingValue = "custodial",
        matchIfMissing = true
)
public class VaultController {

    private final CustodialTokenVault custodialTokenVault;
    private final OwnershipGate ownershipGate;

    public VaultController(CustodialTokenVault custodialTokenVault, OwnershipGate ownershipGate) {
        this.custodialTokenVault = custodialTokenVault;
        this.ownershipGate = ownershipGate;
    }

    @PostMapping("/credits")
    public ResponseEntity<VaultRequests.BalanceResponse> credit(
            @RequestHeader(CallerHeaders.WALLET_ADDRESS) String caller,
            @Valid @RequestBody VaultRequests.CreditRequest request
    ) {
        ownershipGate.requireOwner(caller);
        BigInteger balance = custodialTokenVault.credit(request.token(), request.holder(), request.amount());
        return ResponseEntity.ok(new VaultRequests.BalanceResponse(
                WalletAddresses.normalize(request.token()), WalletAddresses.normalize(request.holder()), balance));
    }

    @GetMapping("/balances/{token}/{holder}")
    public ResponseEntity<VaultRequests.BalanceResponse> balance(
            @PathVariable String token,
            @PathVariable String holder
    ) {
        return ResponseEntity.ok(new VaultRequests.BalanceResponse(
                WalletAddresses.normalize(token),
                WalletAddresses.normalize(holder),
                custodialTokenVault.balanceOf(holder, token)));
    }
}
