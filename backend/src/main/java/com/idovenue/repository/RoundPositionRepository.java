package com.idovenue.repository;

import com.idovenue.model.RoundPosition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RoundPositionRepository extends JpaRepository<RoundPosition, Long> {
    Optional<RoundPosition> findByRoundIdAndWalletAddress(Long roundId, String walletAddress);

    List<RoundPosition> findByWalletAddressAndRoundIdIn(String walletAddress, Collection<Long> roundIds);
}
