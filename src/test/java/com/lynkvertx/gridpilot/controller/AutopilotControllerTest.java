package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.AutopilotStatusDTO;
import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import com.lynkvertx.gridpilot.exception.ConcurrentOverrideConflictException;
import com.lynkvertx.gridpilot.service.AutopilotTickService;
import com.lynkvertx.gridpilot.service.HomeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import javax.persistence.EntityNotFoundException;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AutopilotController.class)
class AutopilotControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HomeService homeService;
    @MockBean
    private AutopilotTickService tickService;

    @Test
    void strategyOutsideItsDomainIsRejected() throws Exception {
        mockMvc.perform(put("/api/homes/1/autopilot/strategy")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"strategy\":\"turbo\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.data.strategy").exists());

        verify(homeService, never()).updateStrategy(anyLong(), anyString());
    }

    @Test
    void validStrategyIsApplied() throws Exception {
        when(homeService.updateStrategy(1L, "eco")).thenReturn(AutopilotStatusDTO.builder()
            .homeId(1L)
            .enabled(true)
            .strategy(AutopilotStrategy.ECO)
            .build());

        mockMvc.perform(put("/api/homes/1/autopilot/strategy")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"strategy\":\"eco\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.strategy").value("eco"));
    }

    @Test
    void gridProtectionNeedsAFlag() throws Exception {
        mockMvc.perform(put("/api/homes/1/autopilot/grid-protection")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.data.enabled").value("enabled is required"));
    }

    @Test
    void unknownHomeIsNotFound() throws Exception {
        when(tickService.evaluateHome(9L)).thenThrow(new EntityNotFoundException("Home not found with id: 9"));

        mockMvc.perform(post("/api/homes/9/autopilot/evaluate"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Home not found with id: 9"));
    }

    @Test
    void lostConcurrentUpdateIsAConflict() throws Exception {
        when(homeService.getAutopilotStatus(1L)).thenThrow(new ConcurrentOverrideConflictException(10L, 3L));

        mockMvc.perform(get("/api/homes/1/autopilot"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value(409));
    }
}
