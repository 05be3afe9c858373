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
 * Home entity
 * Owns the autopilot strategy and links the home to its tariff plan,
 * carbon region and grid operator
 */
@Entity
@Table(name = "home")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Home {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "tariff_plan_id", length = 64)
    private String tariffPlanId;

    @Column(name = "region_code", length = 16)
    private String regionCode;

    @Column(name = "discom_id", length = 64)
    private String discomId;

    @Column(name = "autopilot_enabled", nullable = false)
    private boolean autopilotEnabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "autopilot_strategy", length = 20, nullable = false)
    @Builder.Default
    private AutopilotStrategy strategy = AutopilotStrategy.BALANCED;

    @Column(name = "grid_protection_enabled", nullable = false)
    private boolean gridProtectionEnabled;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
