package com.lynkvertx.gridpilot.entity;

/**
 * Why a pre-action baseline was captured. Each trigger keeps its own baseline
 * so a grid emergency and a penalty window restore independently.
 */
public enum BaselineTrigger {
    STRATEGY,
    GRID_EVENT
}
