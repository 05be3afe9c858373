package com.lynkvertx.gridpilot.entity;

public enum GridSeverity {
    INFO,
    WARNING,
    CRITICAL
}
