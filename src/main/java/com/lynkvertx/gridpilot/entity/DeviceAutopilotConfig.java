package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import javax.persistence.*;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Per-device autopilot preferences and override state.
 * Created on first delegation. The version column backs the optimistic
 * claim taken before any decision is applied.
 */
@Entity
@Table(name = "device_autopilot_config",
    uniqueConstraints = @UniqueConstraint(name = "uk_device_config_appliance", columnNames = "appliance_id"),
    indexes = @Index(name = "idx_device_config_home", columnList = "home_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceAutopilotConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appliance_id", nullable = false)
    private Long applianceId;

    @Column(name = "home_id", nullable = false)
    private Long homeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_action", length = 20, nullable = false)
    @Builder.Default
    private PreferredAction preferredAction = PreferredAction.DELAY_START;

    @Column(name = "protected_window_enabled", nullable = false)
    private boolean protectedWindowEnabled;

    @Column(name = "protected_window_start")
    private LocalTime protectedWindowStart;

    @Column(name = "protected_window_end")
    private LocalTime protectedWindowEnd;

    @Column(name = "is_delegated", nullable = false)
    @Builder.Default
    private boolean delegated = true;

    @Column(name = "override_active", nullable = false)
    private boolean overrideActive;

    @Column(name = "override_until")
    private LocalDateTime overrideUntil;

    @Column(name = "last_evaluated_at")
    private LocalDateTime lastEvaluatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Override flag that has not yet reached its expiry */
    public boolean isOverrideInEffect(LocalDateTime now) {
        return overrideActive && (overrideUntil == null || now.isBefore(overrideUntil));
    }
}
