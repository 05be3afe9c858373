package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.ToggleRequestDTO;
import com.lynkvertx.gridpilot.exception.ActuationFailedException;
import com.lynkvertx.gridpilot.exception.InvalidTimeRangeException;
import com.lynkvertx.gridpilot.service.ApplianceService;
import com.lynkvertx.gridpilot.service.AuditService;
import com.lynkvertx.gridpilot.service.DeviceConfigService;
import com.lynkvertx.gridpilot.service.ScheduleOptionService;
import com.lynkvertx.gridpilot.service.ScheduleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApplianceController.class)
class ApplianceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApplianceService applianceService;
    @MockBean
    private DeviceConfigService deviceConfigService;
    @MockBean
    private ScheduleOptionService scheduleOptionService;
    @MockBean
    private ScheduleService scheduleService;
    @MockBean
    private AuditService auditService;

    @Test
    void unresponsiveDeviceIsServiceUnavailable() throws Exception {
        when(applianceService.toggle(eq(10L), any(ToggleRequestDTO.class)))
            .thenThrow(new ActuationFailedException(10L, "Timed out"));

        mockMvc.perform(post("/api/appliances/10/toggle")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"on\":true,\"source\":\"user\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value(503));
    }

    @Test
    void toggleNeedsTargetState() throws Exception {
        mockMvc.perform(post("/api/appliances/10/toggle")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"user\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.data.on").exists());
    }

    @Test
    void bestWindowNeedsDuration() throws Exception {
        mockMvc.perform(get("/api/appliances/10/best-window"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void invalidDurationIsABadRequest() throws Exception {
        when(scheduleOptionService.getBestWindow(10L, 30.0))
            .thenThrow(new IllegalArgumentException("durationHours must be greater than 0 and at most 24"));

        mockMvc.perform(get("/api/appliances/10/best-window").param("durationHours", "30"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("durationHours must be greater than 0 and at most 24"));
    }

    @Test
    void invalidProtectedWindowIsABadRequest() throws Exception {
        when(deviceConfigService.updateConfig(eq(10L), any()))
            .thenThrow(new InvalidTimeRangeException("Protected window needs both a start and an end time"));

        mockMvc.perform(put("/api/appliances/10/autopilot-config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"delegated\":true,\"protectedWindowEnabled\":true}"))
            .andExpect(status().isBadRequest());
    }
}
