package com.idovenue.service;

import com.idovenue.model.IdSequence;
import com.idovenue.repository.IdSequenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gap-free id counters. The counter row is locked and advanced inside the caller's
 * transaction, so a rolled-back creation does not consume an id.
 */
@Service
@RequiredArgsConstructor
public class IdSequenceService {

    private final IdSequenceRepository idSequenceRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public long next(String sequenceName) {
        IdSequence sequence = idSequenceRepository.findBySequenceNameForUpdate(sequenceName)
                .orElseGet(() -> {
                    IdSequence created = new IdSequence();
                    created.setSequenceName(sequenceName);
                    created.setNextValue(1L);
                    return created;
                });
        long value = sequence.getNextValue();
        sequence.setNextValue(value + 1);
        idSequenceRepository.save(sequence);
        return value;
    }
}
