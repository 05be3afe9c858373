package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Device state captured before autopilot acted on it.
 * One row per (appliance, trigger); restoredAt null means the baseline is still pending.
 */
@Entity
@Table(name = "autopilot_saved_state",
    uniqueConstraints = @UniqueConstraint(name = "uk_saved_state_appliance_trigger",
        columnNames = {"appliance_id", "trigger_type"}),
    indexes = @Index(name = "idx_saved_state_home", columnList = "home_id, restored_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutopilotSavedState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "home_id", nullable = false)
    private Long homeId;

    @Column(name = "appliance_id", nullable = false)
    private Long applianceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", length = 20, nullable = false)
    private BaselineTrigger triggerType;

    @Enumerated(EnumType.STRING)
    @Column(name = "prev_status", length = 20, nullable = false)
    private ApplianceStatus prevStatus;

    @Column(name = "prev_eco_mode", nullable = false)
    private boolean prevEcoMode;

    @Column(name = "saved_at", nullable = false)
    private LocalDateTime savedAt;

    @Column(name = "restored_at")
    private LocalDateTime restoredAt;

    public boolean isPending() {
        return restoredAt == null;
    }
}
