package com.lynkvertx.gridpilot.entity;

import java.time.DayOfWeek;
import java.util.Collection;

/**
 * Recurrence rule of an appliance schedule.
 */
public enum RepeatType {
    ONCE,
    DAILY,
    WEEKDAYS,
    WEEKENDS,
    CUSTOM;

    /**
     * Whether a schedule with this rule fires on the given day.
     * customDays uses ISO numbering (1 = Monday .. 7 = Sunday).
     */
    public boolean appliesOn(DayOfWeek day, Collection<Integer> customDays) {
        switch (this) {
            case WEEKDAYS:
                return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
            case WEEKENDS:
                return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
            case CUSTOM:
                return customDays != null && customDays.contains(day.getValue());
            default:
                return true;
        }
    }
}
