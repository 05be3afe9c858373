package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import javax.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Grid carbon intensity (gCO2/kWh) for one hour of the day in a region.
 * Several versions may exist per hour; the active row with the latest
 * effectiveFrom wins.
 */
@Entity
@Table(name = "carbon_intensity",
    indexes = @Index(name = "idx_carbon_region_hour", columnList = "region_code, hour_of_day, active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarbonIntensity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "region_code", length = 16, nullable = false)
    private String regionCode;

    @Column(name = "hour_of_day", nullable = false)
    private Integer hourOfDay;

    @Column(name = "gco2_per_kwh", precision = 8, scale = 2, nullable = false)
    private BigDecimal intensity;

    @Column(length = 50)
    private String source;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
