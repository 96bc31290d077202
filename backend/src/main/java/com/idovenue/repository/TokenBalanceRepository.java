package com.idovenue.repository;

import com.idovenue.model.TokenBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TokenBalanceRepository extends JpaRepository<TokenBalance, Long> {
    Optional<TokenBalance> findByTokenAddressAndHolderAddress(String tokenAddress, String holderAddress);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from TokenBalance b where b.tokenAddress = :tokenAddress and b.holderAddress = :holderAddress")
    Optional<TokenBalance> findForUpdate(@Param("tokenAddress") String tokenAddress,
                                         @Param("holderAddress") String holderAddress);
}
