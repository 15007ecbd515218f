package com.swiftload.loadservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A trucker's priced offer against a load.
 * Bids are never deleted; REJECTED and WITHDRAWN are kept for audit.
 */
@Entity
@Table(name = "bids", indexes = {
        @Index(name = "idx_bids_load_status", columnList = "load_id,status"),
        @Index(name = "idx_bids_trucker", columnList = "trucker_id,created_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bid {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "load_id", nullable = false)
    private UUID loadId;

    @Column(name = "trucker_id", nullable = false)
    private UUID truckerId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    // Optional note to the shipper
    @Column(length = 1000)
    private String message;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private BidStatus status = BidStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
