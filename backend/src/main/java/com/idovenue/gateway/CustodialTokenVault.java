package com.idovenue.gateway;

import com.idovenue.config.IdoVenueProperties;
import com.idovenue.model.TokenBalance;
import com.idovenue.repository.TokenBalanceRepository;
import com.idovenue.service.WalletAddresses;
import com.idovenue.web.IdoVenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Token collaborator backed by the venue database. Balances live in the same transaction as
 * the round ledger, so a failed venue operation also undoes its token movements.
 */
@Service
@ConditionalOnProperty(
        prefix = "ido.vault",
        name = "mode",
        havingValue = "custodial",
        matchIfMissing = true
)
public class CustodialTokenVault implements TokenTransferGateway, TokenMetadataGateway {

    private static final Logger log = LoggerFactory.getLogger(CustodialTokenVault.class);

    private final TokenBalanceRepository tokenBalanceRepository;
    private final IdoVenueProperties idoVenueProperties;
    private final Clock clock;

    public CustodialTokenVault(TokenBalanceRepository tokenBalanceRepository,
                               IdoVenueProperties idoVenueProperties,
                               Clock clock) {
        this.tokenBalanceRepository = tokenBalanceRepository;
        this.idoVenueProperties = idoVenueProperties;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pull(String token, String from, BigInteger amount) {
        move(token, from, custody(), amount);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void push(String token, String to, BigInteger amount) {
        move(token, custody(), to, amount);
    }

    @Override
    public int decimals(String token) {
        Integer configured = idoVenueProperties.getVault().getTokenDecimals().entrySet().stream()
                .filter(entry -> WalletAddresses.normalize(entry.getKey()).equals(WalletAddresses.normalize(token)))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        return configured != null ? configured : idoVenueProperties.getVault().getDefaultDecimals();
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String holder, String token) {
        return tokenBalanceRepository.findByTokenAddressAndHolderAddress(
                        WalletAddresses.normalize(token), WalletAddresses.normalize(holder))
                .map(TokenBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }

    /**
     * Mints balance to a holder, e.g. the operator depositing sale inventory into custody.
     */
    @Transactional
    public BigInteger credit(String token, String holder, BigInteger amount) {
        requirePositive(amount);
        TokenBalance balance = lockOrCreate(WalletAddresses.normalize(token), WalletAddresses.normalize(holder));
        balance.setBalance(balance.getBalance().add(amount));
        balance.setUpdatedAt(OffsetDateTime.now(clock));
        store(balance);
        log.info("Credited {} of {} to {}, new balance {}", amount, token, holder, balance.getBalance());
        return balance.getBalance();
    }

    private void move(String token, String from, String to, BigInteger amount) {
        requirePositive(amount);
        String tokenAddress = WalletAddresses.normalize(token);
        String fromAddress = WalletAddresses.normalize(from);
        String toAddress = WalletAddresses.normalize(to);

        // Rows are always locked in holder order so opposite transfers cannot deadlock
        Map<String, TokenBalance> locked = new TreeMap<>();
        for (String holder : new TreeSet<>(List.of(fromAddress, toAddress))) {
            locked.put(holder, lockOrCreate(tokenAddress, holder));
        }
        TokenBalance source = locked.get(fromAddress);
        TokenBalance target = locked.get(toAddress);

        if (source.getBalanceId() == null) {
            throw IdoVenueException.insufficientBalance(token, from, "no balance");
        }
        if (source.getBalance().compareTo(amount) < 0) {
            throw IdoVenueException.insufficientBalance(
                    token, from, "has " + source.getBalance() + ", needs " + amount);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        source.setBalance(source.getBalance().subtract(amount));
        source.setUpdatedAt(now);
        store(source);

        target.setBalance(target.getBalance().add(amount));
        target.setUpdatedAt(now);
        store(target);

        log.debug("Moved {} of {} from {} to {}", amount, tokenAddress, fromAddress, toAddress);
    }

    private TokenBalance lockOrCreate(String tokenAddress, String holderAddress) {
        return tokenBalanceRepository.findForUpdate(tokenAddress, holderAddress).orElseGet(() -> {
            TokenBalance created = new TokenBalance();
            created.setTokenAddress(tokenAddress);
            created.setHolderAddress(holderAddress);
            created.setBalance(BigInteger.ZERO);
            created.setUpdatedAt(OffsetDateTime.now(clock));
            return created;
        });
    }

    private void store(TokenBalance balance) {
        if (balance.getBalanceId() != null) {
            tokenBalanceRepository.save(balance);
            return;
        }
        try {
            tokenBalanceRepository.saveAndFlush(balance);
        } catch (DataIntegrityViolationException e) {
            // Another request created the balance row concurrently
            log.warn("Balance row for {} of {} was created concurrently", balance.getHolderAddress(),
                    balance.getTokenAddress());
            throw IdoVenueException.balanceConflict(balance.getTokenAddress(), balance.getHolderAddress());
        }
    }

    private String custody() {
        return idoVenueProperties.getCustodyAddress();
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw IdoVenueException.invalidAmount("Transfer amount must be positive: " + amount);
        }
    }
}
