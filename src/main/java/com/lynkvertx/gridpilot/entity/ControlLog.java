package com.lynkvertx.gridpilot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Append-only audit trail of device actuations
 */
@Entity
@Table(name = "control_log", indexes = @Index(name = "idx_control_log_appliance", columnList = "appliance_id, logged_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlLog {

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_FAILURE = "failure";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appliance_id", nullable = false)
    private Long applianceId;

    @Column(nullable = false, length = 40)
    private String action;

    @Column(name = "trigger_source", nullable = false, length = 40)
    private String triggerSource;

    @Column(name = "result_status", nullable = false, length = 20)
    private String result;

    @Column(length = 500)
    private String message;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "logged_at", nullable = false)
    private LocalDateTime loggedAt;
}
