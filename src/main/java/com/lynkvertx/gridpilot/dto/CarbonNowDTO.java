package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Current grid carbon intensity for a home's region
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CarbonNowDTO {

    private Long homeId;
    private String regionCode;
    private int hour;

    /** gCO2/kWh */
    private BigDecimal intensity;

    private boolean cleanWindow;
    private BigDecimal dailyMean;
    private List<Integer> cleanestHours;
    private LocalDateTime computedAt;
    private boolean stale;
}
