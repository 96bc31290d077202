package com.idovenue.repository;

import com.idovenue.model.MetaIdoParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MetaIdoParticipantRepository extends JpaRepository<MetaIdoParticipant, Long> {
    Optional<MetaIdoParticipant> findByMetaIdoIdAndWalletAddress(Long metaIdoId, String walletAddress);

    long countByMetaIdoIdAndRegisteredTrue(Long metaIdoId);
}
