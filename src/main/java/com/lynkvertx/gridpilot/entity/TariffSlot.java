package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import javax.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Time-of-use tariff slot
 * [startHour, endHour) with endHour exclusive; start > end wraps midnight
 */
@Entity
@Table(name = "tariff_slot", indexes = @Index(name = "idx_tariff_slot_plan", columnList = "plan_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TariffSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plan_id", length = 64, nullable = false)
    private String planId;

    @Column(length = 100)
    private String label;

    @Column(name = "start_hour", nullable = false)
    private Integer startHour;

    @Column(name = "end_hour", nullable = false)
    private Integer endHour;

    @Column(name = "rate", precision = 10, scale = 4, nullable = false)
    private BigDecimal rate;

    @Column(name = "slot_type", length = 20, nullable = false)
    private String slotType;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
