package com.idovenue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "id_sequence")
public class IdSequence {

    public static final String ROUND = "round";
    public static final String META_IDO = "meta_ido";

    @Id
    @Column(name = "sequence_name", nullable = false, updatable = false, length = 64)
    private String sequenceName;

    @Column(name = "next_value", nullable = false)
    private long nextValue = 1L;
}
