package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Appliance entity
 * Current power state as last reported or actuated
 */
@Entity
@Table(name = "appliance")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Appliance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "home_id", nullable = false)
    private Long homeId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 50)
    private String category;

    @Column(name = "rated_power_w", nullable = false)
    private Integer ratedPowerW;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    @Builder.Default
    private ApplianceStatus status = ApplianceStatus.OFF;

    @Column(name = "eco_mode_enabled", nullable = false)
    private boolean ecoModeEnabled;

    @Column(nullable = false)
    @Builder.Default
    private boolean controllable = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
