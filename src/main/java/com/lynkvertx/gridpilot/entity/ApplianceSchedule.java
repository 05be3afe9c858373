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
 * Appliance run schedule.
 * activeApplianceId mirrors applianceId while the row is active and is null otherwise;
 * its unique constraint makes a second active row per appliance impossible at the database level.
 */
@Entity
@Table(name = "appliance_schedule",
    uniqueConstraints = @UniqueConstraint(name = "uk_schedule_active_appliance", columnNames = "active_appliance_id"),
    indexes = @Index(name = "idx_schedule_appliance", columnList = "appliance_id, is_active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplianceSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appliance_id", nullable = false)
    private Long applianceId;

    @Column(name = "home_id", nullable = false)
    private Long homeId;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_type", length = 20, nullable = false)
    @Builder.Default
    private RepeatType repeatType = RepeatType.ONCE;

    @Column(name = "custom_days", length = 64)
    private String customDays;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "active_appliance_id")
    private Long activeApplianceId;

    @Column(name = "last_executed")
    private LocalDateTime lastExecuted;

    @Column(name = "created_by", length = 20)
    private String createdBy;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
