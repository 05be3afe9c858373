package com.lynkvertx.gridpilot.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live grid health reported by a grid data source
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridReading {

    /** normal, stressed or critical */
    private String status;
    private double frequencyHz;
    private double voltageV;
    private String message;
}
