package com.idovenue.repository;

import com.idovenue.model.IdoRound;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IdoRoundRepository extends JpaRepository<IdoRound, Long> {
    List<IdoRound> findAllByOrderByRoundIdAsc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from IdoRound r where r.roundId = :roundId")
    Optional<IdoRound> findByRoundIdForUpdate(@Param("roundId") Long roundId);
}
