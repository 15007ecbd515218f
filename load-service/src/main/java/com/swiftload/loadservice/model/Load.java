package com.swiftload.loadservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "loads", indexes = {
        @Index(name = "idx_loads_shipper", columnList = "shipper_id"),
        @Index(name = "idx_loads_trucker", columnList = "assigned_trucker_id"),
        @Index(name = "idx_loads_status", columnList = "status")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Load {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // Shipper who posted the load (JWT subject)
    @Column(name = "shipper_id", nullable = false)
    private UUID shipperId;

    // Cargo description shown on the board
    @Column(nullable = false)
    private String title;

    @Column(name = "pickup_city", nullable = false)
    private String pickupCity;

    @Column(name = "pickup_state")
    private String pickupState;

    @Column(name = "pickup_date")
    private LocalDate pickupDate;

    @Column(name = "delivery_city", nullable = false)
    private String deliveryCity;

    @Column(name = "delivery_state")
    private String deliveryState;

    @Column(name = "delivery_date")
    private LocalDate deliveryDate;

    @Column(name = "weight_lbs")
    private Double weightLbs;

    // Dry Van / Reefer / Flatbed ...
    private String equipment;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal rate;

    @Column(length = 2000)
    private String notes;

    // Written only through LoadService.setStatus / assignTrucker
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private LoadStatus status;

    // Trucker whose bid was accepted; null while OPEN and after cancellation
    @Column(name = "assigned_trucker_id")
    private UUID assignedTruckerId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Optimistic locking: second line of defence behind the row lock taken by
    // every transition
    @Version
    @Column(name = "version")
    private Long version;
}
