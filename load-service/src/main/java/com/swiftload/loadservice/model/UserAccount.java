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

import java.time.Instant;
import java.util.UUID;

/**
 * Local profile of a marketplace user. Credentials live with the identity
 * provider; this row is created on the user's first call to /users/me.
 */
@Entity
@Table(name = "user_accounts")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id // JWT subject ('sub' claim)
    @ToString.Include
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private UserRole role;

    private String name;

    private String email;

    private String company;

    private String phone;

    // MC/DOT number, truckers only
    @Column(name = "mc_number")
    private String mcNumber;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
