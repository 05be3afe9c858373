package com.lynkvertx.gridpilot.exception;

/**
 * Raised when an hour-indexed reference table does not partition the 24-hour day:
 * gaps, overlaps, or hours outside [0, 23].
 * Thrown at load/save time so evaluation never sees a malformed table.
 */
public class InvalidTimeRangeException extends IllegalArgumentException {

    public InvalidTimeRangeException(String message) {
        super(message);
    }
}
