package com.lanparty.booking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A bookable gaming station.
 *
 * <p>The station catalog is owned elsewhere; this service only reads stations to check that
 * a reservation references an existing one, to attach a summary to reservation reads, and to
 * take the per-station row lock that serialises conflicting writes
 * (see {@code StationRepository#findByIdForUpdate}).
 */
@Entity
@Table(name = "stations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Station extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /** Catalog availability label ("available", "maintenance", ...). Not used for conflict logic. */
    @Column(name = "status", nullable = false, length = 20)
    private String status;
}
