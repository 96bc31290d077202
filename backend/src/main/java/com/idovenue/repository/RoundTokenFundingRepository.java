package com.idovenue.repository;

import com.idovenue.model.RoundTokenFunding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoundTokenFundingRepository extends JpaRepository<RoundTokenFunding, Long> {
    Optional<RoundTokenFunding> findByRoundIdAndTokenAddress(Long roundId, String tokenAddress);

    List<RoundTokenFunding> findByRoundIdOrderByTokenAddressAsc(Long roundId);
}
