package com.lynkvertx.gridpilot.adapter;

import com.lynkvertx.gridpilot.entity.GridEvent;

import java.util.List;

/**
 * Provider of live grid status for a grid operator (DISCOM).
 * Events it reports are not persisted; they are merged with stored events on every query.
 */
public interface GridDataSource {

    GridReading getStatus(String discomId);

    List<GridEvent> getActiveEvents(String discomId);
}
