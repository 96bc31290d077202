package com.idovenue.repository;

import com.idovenue.model.MetaIdo;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MetaIdoRepository extends JpaRepository<MetaIdo, Long> {
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from MetaIdo m where m.metaIdoId = :metaIdoId")
    Optional<MetaIdo> findByMetaIdoIdForUpdate(@Param("metaIdoId") Long metaIdoId);
}
