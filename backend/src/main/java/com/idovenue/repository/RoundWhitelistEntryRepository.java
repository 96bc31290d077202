package com.idovenue.repository;

import com.idovenue.model.RoundWhitelistEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RoundWhitelistEntryRepository extends JpaRepository<RoundWhitelistEntry, Long> {
    boolean existsByRoundIdAndWalletAddress(Long roundId, String walletAddress);

    long deleteByRoundIdAndWalletAddress(Long roundId, String walletAddress);
}
