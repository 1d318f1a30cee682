package com.lanparty.booking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import java.time.Instant;

/**
 * Shared superclass for all JPA entities.
 *
 * <p>Provides the audit timestamps ({@code created_at} and {@code updated_at}) via JPA
 * lifecycle callbacks. Neither value is ever taken from a client request: {@code created_at}
 * is set once on first persist ({@code updatable = false}) and {@code updated_at} is
 * refreshed on every UPDATE via {@link #onUpdate()}.
 *
 * <p>The protected no-arg constructor is required by JPA and
 * Hibernate's proxy machinery.
 */
@MappedSuperclass
public abstract class BaseEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BaseEntity() {}

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Refreshes {@code updated_at} and marks the entity dirty, so the next flush writes the row
     * even when no other column changed.
     */
    public void touch() {
        updatedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
