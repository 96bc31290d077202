package com.idovenue.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Group of rounds sharing one participant rank/multiplier table. Membership order carries
 * no meaning; removal swaps the last member into the freed slot.
 */
@Getter
@Setter
@Entity
@Table(name = "meta_ido")
public class MetaIdo {

    @Id
    @Column(name = "meta_ido_id", nullable = false, updatable = false)
    private Long metaIdoId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "meta_ido_round", joinColumns = @JoinColumn(name = "meta_ido_id"))
    @OrderColumn(name = "slot")
    @Column(name = "round_id", nullable = false)
    private List<Long> roundIds = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    /**
     * @return false when the round is not a member
     */
    public boolean swapRemove(Long roundId) {
        int index = roundIds.indexOf(roundId);
        if (index < 0) {
            return false;
        }
        int last = roundIds.size() - 1;
        roundIds.set(index, roundIds.get(last));
        roundIds.remove(last);
        return true;
    }
}
