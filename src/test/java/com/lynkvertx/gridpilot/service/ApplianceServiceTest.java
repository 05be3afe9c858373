package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.dto.ApplianceDTO;
import com.lynkvertx.gridpilot.dto.ToggleRequestDTO;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.ApplianceStatus;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.exception.ActuationFailedException;
import com.lynkvertx.gridpilot.repository.ApplianceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApplianceServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-01T13:45:00Z"), ZoneId.of("Asia/Kolkata"));

    @Mock
    private ApplianceRepository applianceRepository;
    @Mock
    private HomeService homeService;
    @Mock
    private DeviceControlService deviceControl;
    @Mock
    private OverrideService overrideService;

    private ApplianceService applianceService;
    private Home home;

    @BeforeEach
    void setUp() {
        applianceService = new ApplianceService(applianceRepository, homeService, deviceControl, overrideService, CLOCK);
        home = Home.builder().id(1L).name("Test home").autopilotEnabled(true).build();
    }

    private Appliance appliance(ApplianceStatus status) {
        return Appliance.builder().id(10L).homeId(1L).name("AC").category("ac").ratedPowerW(1500).status(status).build();
    }

    @Test
    void manualToggleRaisesOverride() {
        when(applianceRepository.findById(10L))
            .thenReturn(Optional.of(appliance(ApplianceStatus.OFF)), Optional.of(appliance(ApplianceStatus.ON)));
        when(homeService.findHome(1L)).thenReturn(home);
        when(deviceControl.execute(10L, ActuationCommand.TURN_ON, "turn_on", "physical"))
            .thenReturn(ActuationResult.ok("TURN_ON applied"));

        ApplianceDTO result = applianceService.toggle(10L, new ToggleRequestDTO(true, "physical"));

        assertThat(result.getStatus()).isEqualTo(ApplianceStatus.ON);
        verify(overrideService).raiseOnHumanToggle(home, 10L, LocalDateTime.now(CLOCK));
    }

    @Test
    void failedToggleRaisesNoOverride() {
        when(applianceRepository.findById(10L)).thenReturn(Optional.of(appliance(ApplianceStatus.ON)));
        when(homeService.findHome(1L)).thenReturn(home);
        when(deviceControl.execute(10L, ActuationCommand.TURN_OFF, "turn_off", "user"))
            .thenReturn(ActuationResult.failure("Timed out"));

        assertThatThrownBy(() -> applianceService.toggle(10L, new ToggleRequestDTO(false, null)))
            .isInstanceOf(ActuationFailedException.class)
            .hasMessageContaining("Timed out");
        verify(overrideService, never()).raiseOnHumanToggle(any(), any(), any());
    }
}
