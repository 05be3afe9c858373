package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Grid operator event (peak alert, frequency drop, load shedding, ...)
 */
@Entity
@Table(name = "grid_event", indexes = @Index(name = "idx_grid_event_discom", columnList = "discom_id, is_active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "discom_id", length = 64, nullable = false)
    private String discomId;

    @Column(name = "event_type", length = 40, nullable = false)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private GridSeverity severity;

    @Column(length = 500)
    private String message;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "affected_areas", length = 2000)
    private String affectedAreas;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    /** Started, not ended, and still flagged active at the given time */
    public boolean isInEffect(LocalDateTime now) {
        return active && !startTime.isAfter(now) && (endTime == null || endTime.isAfter(now));
    }
}
