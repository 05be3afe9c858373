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
import java.util.List;

/**
 * Tariff slot of a plan. endHour is exclusive; start > end wraps midnight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TariffSlotDTO {

    private Long id;

    private String planId;

    private String label;

    @NotNull
    @Min(0)
    @Max(23)
    private Integer startHour;

    @NotNull
    @Min(0)
    @Max(24)
    private Integer endHour;

    @NotNull
    @DecimalMin("0")
    private BigDecimal rate;

    /** off-peak, normal, peak */
    private String slotType;

    /**
     * Replace-all payload for a plan
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TariffSlotBatchDTO {
        @NotEmpty(message = "At least one slot is required")
        private List<@Valid TariffSlotDTO> slots;
    }
}
