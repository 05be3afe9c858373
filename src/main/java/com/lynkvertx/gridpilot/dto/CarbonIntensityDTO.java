package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Hourly carbon intensity of a region
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarbonIntensityDTO {

    private Long id;

    private String regionCode;

    @NotNull
    @Min(0)
    @Max(23)
    private Integer hour;

    /** gCO2/kWh */
    @NotNull
    @DecimalMin("0")
    private BigDecimal intensity;

    private String source;

    private LocalDate effectiveFrom;

    private Boolean active;

    /**
     * Replace-all payload for a region; source and effectiveFrom apply to rows that leave them empty
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CarbonProfileBatchDTO {
        private String source;
        private LocalDate effectiveFrom;

        @NotEmpty(message = "At least one hourly intensity is required")
        private List<@Valid CarbonIntensityDTO> intensities;
    }
}
