package com.lynkvertx.gridpilot.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one actuation call. Failures are values, not exceptions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActuationResult {

    private boolean success;
    private String message;
    private long responseTimeMs;

    public static ActuationResult ok(String message) {
        return ActuationResult.builder().success(true).message(message).build();
    }

    public static ActuationResult failure(String message) {
        return ActuationResult.builder().success(false).message(message).build();
    }
}
