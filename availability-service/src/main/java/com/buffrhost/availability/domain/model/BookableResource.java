package com.buffrhost.availability.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A room or restaurant table that can be reserved for a time interval.
 * Immutable after creation except for soft deactivation. The row is the lock point
 * for every reservation made against it.
 */
@Entity
@Table(name = "bookable_resources",
        uniqueConstraints = @UniqueConstraint(name = "uk_resource_property_code", columnNames = {"property_id", "code"}),
        indexes = @Index(name = "idx_resource_property", columnList = "property_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class BookableResource {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false, updatable = false)
    private Long propertyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20, updatable = false)
    private ResourceKind kind;

    @Column(name = "code", nullable = false, length = 50, updatable = false)
    private String code;

    @Column(name = "capacity", nullable = false, updatable = false)
    private Integer capacity;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    // Bumped by the optimistic reservation strategy to serialise concurrent bookings
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public boolean canHost(Integer partySize) {
        return partySize == null || partySize <= capacity;
    }

    public void deactivate() {
        this.active = false;
    }
}
