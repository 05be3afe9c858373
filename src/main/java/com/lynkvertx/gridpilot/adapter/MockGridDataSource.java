package com.lynkvertx.gridpilot.adapter;

import com.lynkvertx.gridpilot.entity.GridEvent;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Stand-in until a real DISCOM feed exists: the grid is always normal and raises no events.
 * A real feed replaces it as the primary GridDataSource bean.
 */
@Component
public class MockGridDataSource implements GridDataSource {

    @Override
    public GridReading getStatus(String discomId) {
        return GridReading.builder()
            .status("normal")
            .frequencyHz(50.02)
            .voltageV(230.5)
            .build();
    }

    @Override
    public List<GridEvent> getActiveEvents(String discomId) {
        return Collections.emptyList();
    }
}
